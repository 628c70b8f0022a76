package dev.poc.trello.config;

import java.util.List;

import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.authorization.AuthorizationManager;
import org.springframework.security.authorization.AuthorizationManagers;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.provisioning.InMemoryUserDetailsManager;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.IpAddressAuthorizationManager;
import org.springframework.security.web.access.intercept.RequestAuthorizationContext;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

/**
 * HTTP security for the MCP transport: CORS, no CSRF, and optional basic authentication on the
 * MCP endpoint, the tool catalog and the credential session endpoints. With basic authentication
 * off, logout is accepted from loopback addresses only.
 */
@Configuration
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@EnableConfigurationProperties(McpSecurityProperties.class)
public class SecurityConfig {

	private static final AuthorizationManager<RequestAuthorizationContext> LOCAL_CALLER = AuthorizationManagers
		.anyOf(IpAddressAuthorizationManager.hasIpAddress("127.0.0.1"), IpAddressAuthorizationManager.hasIpAddress("::1"));

	@Bean
	public UserDetailsService userDetailsService(McpSecurityProperties securityProperties) {
		UserDetails user = User.withUsername(securityProperties.username())
			.password("{noop}" + securityProperties.password())
			.roles("MCP_CLIENT")
			.build();
		return new InMemoryUserDetailsManager(user);
	}

	@Bean
	public SecurityFilterChain securityFilterChain(HttpSecurity http, McpSecurityProperties securityProperties,
			McpTransportProperties transportProperties) throws Exception {
		http.csrf(AbstractHttpConfigurer::disable);
		http.cors(Customizer.withDefaults());
		if (securityProperties.enabled()) {
			http.authorizeHttpRequests(registry -> registry
				.requestMatchers(transportProperties.getEndpoint(), "/tools", "/auth/**")
				.authenticated()
				.anyRequest()
				.permitAll());
			http.httpBasic(Customizer.withDefaults());
		}
		else {
			http.authorizeHttpRequests(registry -> registry.requestMatchers(HttpMethod.POST, "/auth/logout")
				.access(LOCAL_CALLER)
				.anyRequest()
				.permitAll());
		}
		return http.build();
	}

	@Bean
	public CorsConfigurationSource corsConfigurationSource(McpSecurityProperties securityProperties) {
		CorsConfiguration cors = new CorsConfiguration();
		cors.setAllowedOriginPatterns(securityProperties.allowedOrigins());
		cors.setAllowedMethods(List.of("GET", "POST", "OPTIONS"));
		cors.setAllowedHeaders(List.of("*"));
		UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
		source.registerCorsConfiguration("/**", cors);
		return source;
	}

}

package dev.poc.trello.credential;

import java.awt.Desktop;
import java.awt.GraphicsEnvironment;
import java.io.IOException;
import java.io.PrintWriter;
import java.net.URI;
import java.util.Optional;

import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Terminal based prompter. Opens the Trello app-key page in a browser when possible and reads the
 * API key and token from the console through JLine, re-asking a bounded number of times when a value
 * is too short.
 */
public class ConsoleCredentialPrompter implements CredentialPrompter {

	private static final Logger logger = LoggerFactory.getLogger(ConsoleCredentialPrompter.class);

	private static final String RULE = "=".repeat(60);

	private final int minLength;

	private final int maxAttempts;

	public ConsoleCredentialPrompter(int minLength, int maxAttempts) {
		this.minLength = minLength;
		this.maxAttempts = maxAttempts;
	}

	@Override
	public boolean isInteractive() {
		return System.console() != null;
	}

	@Override
	public Optional<CredentialPair> promptForPair(String loginUrl) {
		try (Terminal terminal = TerminalBuilder.builder().system(true).build()) {
			LineReader reader = LineReaderBuilder.builder().terminal(terminal).build();
			PrintWriter out = terminal.writer();
			out.println();
			out.println(RULE);
			out.println("TRELLO LOGIN REQUIRED");
			out.println(RULE);
			out.println("1. Open " + loginUrl);
			out.println("2. Copy your API Key (shown at the top)");
			out.println("3. Follow the 'Token' link to generate or view your token");
			out.println("4. Paste both values below");
			out.println();
			out.flush();
			openBrowser(loginUrl);

			Optional<String> apiKey = readValue(reader, out, "Enter your Trello API Key: ", null);
			if (apiKey.isEmpty()) {
				return Optional.empty();
			}
			Optional<String> token = readValue(reader, out, "Enter your Trello Token: ", '*');
			if (token.isEmpty()) {
				return Optional.empty();
			}
			out.println("Credentials received and cached for this session");
			out.println(RULE);
			out.flush();
			return Optional.of(new CredentialPair(apiKey.get(), token.get()));
		}
		catch (UserInterruptException | EndOfFileException e) {
			logger.info("Trello login prompt aborted by user");
			return Optional.empty();
		}
		catch (IOException e) {
			logger.warn("Unable to open terminal for Trello login", e);
			return Optional.empty();
		}
	}

	private Optional<String> readValue(LineReader reader, PrintWriter out, String prompt, Character mask) {
		for (int attempt = 1; attempt <= this.maxAttempts; attempt++) {
			String value = reader.readLine(prompt, mask);
			if (value != null && value.strip().length() >= this.minLength) {
				return Optional.of(value.strip());
			}
			out.println("Invalid value. It should be at least " + this.minLength + " characters.");
			out.flush();
		}
		logger.warn("Giving up on Trello login after {} invalid attempts", this.maxAttempts);
		return Optional.empty();
	}

	private void openBrowser(String loginUrl) {
		if (GraphicsEnvironment.isHeadless() || !Desktop.isDesktopSupported()
				|| !Desktop.getDesktop().isSupported(Desktop.Action.BROWSE)) {
			logger.debug("No desktop browser available, user has to open {} manually", loginUrl);
			return;
		}
		try {
			Desktop.getDesktop().browse(URI.create(loginUrl));
			logger.info("Opened Trello API key page in browser");
		}
		catch (IOException | UnsupportedOperationException e) {
			logger.warn("Could not open browser for {}", loginUrl, e);
		}
	}

}

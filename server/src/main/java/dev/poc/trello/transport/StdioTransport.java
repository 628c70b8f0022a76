package dev.poc.trello.transport;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;

import dev.poc.trello.protocol.McpProtocolHandler;

/**
 * Newline-delimited JSON-RPC over a pair of streams, normally standard input and output. Each line
 * is handled on a worker thread; responses are written whole, one per line.
 */
public class StdioTransport {

	private static final Logger logger = LoggerFactory.getLogger(StdioTransport.class);

	private static final String TRANSPORT = "stdio";

	private static final Duration DRAIN_TIMEOUT = Duration.ofSeconds(30);

	private final McpProtocolHandler protocolHandler;

	private final InputStream in;

	private final OutputStream out;

	private final Object writeLock = new Object();

	private final AtomicInteger workerCounter = new AtomicInteger();

	private final ExecutorService requestExecutor = Executors.newCachedThreadPool(runnable -> {
		Thread thread = new Thread(runnable, "mcp-stdio-worker-" + this.workerCounter.incrementAndGet());
		thread.setDaemon(true);
		return thread;
	});

	private Thread readerThread;

	private volatile boolean running;

	public StdioTransport(McpProtocolHandler protocolHandler, InputStream in, OutputStream out) {
		this.protocolHandler = protocolHandler;
		this.in = in;
		this.out = out;
	}

	/**
	 * Start reading messages. The reader thread is not a daemon, so it keeps the application alive
	 * until the input is closed.
	 */
	public synchronized void start() {
		if (this.running) {
			return;
		}
		this.running = true;
		this.readerThread = new Thread(this::readLoop, "mcp-stdio-reader");
		this.readerThread.start();
		logger.info("MCP stdio transport started");
	}

	public void stop() {
		this.running = false;
		this.requestExecutor.shutdown();
		logger.info("MCP stdio transport stopped");
	}

	/**
	 * Wait for the input to be exhausted and every accepted message to be answered.
	 * @param timeout maximum time to wait
	 * @return {@code true} if the transport finished in time
	 * @throws InterruptedException if interrupted while waiting
	 */
	boolean awaitCompletion(Duration timeout) throws InterruptedException {
		Thread reader = this.readerThread;
		if (reader != null) {
			reader.join(timeout.toMillis());
		}
		return (reader == null || !reader.isAlive())
				&& this.requestExecutor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
	}

	private void readLoop() {
		try (BufferedReader reader = new BufferedReader(new InputStreamReader(this.in, StandardCharsets.UTF_8))) {
			String line;
			while (this.running && (line = reader.readLine()) != null) {
				if (line.isBlank()) {
					continue;
				}
				String message = line;
				Wire.rx(TRANSPORT, message);
				try {
					this.requestExecutor.execute(() -> process(message));
				}
				catch (RejectedExecutionException e) {
					logger.warn("Dropping message received while shutting down");
				}
			}
			logger.info("Input closed, draining pending requests");
		}
		catch (IOException e) {
			if (this.running) {
				logger.warn("Failed to read from input", e);
			}
		}
		finally {
			this.running = false;
			this.requestExecutor.shutdown();
			drain();
		}
	}

	private void drain() {
		try {
			if (!this.requestExecutor.awaitTermination(DRAIN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
				logger.warn("Pending requests did not finish within {}", DRAIN_TIMEOUT);
			}
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		}
	}

	private void process(String message) {
		this.protocolHandler.handle(message).ifPresent(this::write);
	}

	private void write(JsonNode response) {
		String json = response.toString();
		Wire.tx(TRANSPORT, json);
		synchronized (this.writeLock) {
			try {
				this.out.write((json + "\n").getBytes(StandardCharsets.UTF_8));
				this.out.flush();
			}
			catch (IOException e) {
				logger.warn("Failed to write response", e);
			}
		}
	}

}

/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.jsonrpc.util;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Arrays;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

import io.jsonrpc.spec.JsonRpcException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * 以换行分隔帧的持久连接（套接字或任意一对流）。
 *
 * <p>
 * 入站帧由一个专用线程读取；所有出站帧都在一个专用线程上写入，因此多个并发调用共享同一个写入端时
 * 帧之间不会交错。帧本身不能包含换行符，Jackson的紧凑输出满足这一点。
 */
public class LineDelimitedConnection {

	private static final Logger logger = LoggerFactory.getLogger(LineDelimitedConnection.class);

	private final String name;

	private final InputStream input;

	private final OutputStream output;

	private final Sinks.Many<byte[]> inboundSink = Sinks.many().unicast().onBackpressureBuffer();

	private final Scheduler inboundScheduler;

	private final Scheduler outboundScheduler;

	private final AtomicBoolean started = new AtomicBoolean(false);

	private final AtomicBoolean closed = new AtomicBoolean(false);

	private volatile boolean isClosing = false;

	public LineDelimitedConnection(String name, InputStream input, OutputStream output) {
		Assert.hasText(name, "The name can not be empty");
		Assert.notNull(input, "The input stream can not be null");
		Assert.notNull(output, "The output stream can not be null");
		this.name = name;
		this.input = input;
		this.output = output;
		this.inboundScheduler = Schedulers.fromExecutorService(Executors.newSingleThreadExecutor(),
				name + "-inbound");
		this.outboundScheduler = Schedulers.fromExecutorService(Executors.newSingleThreadExecutor(),
				name + "-outbound");
	}

	/**
	 * 入站帧。读取在第一次调用时开始；只允许一个订阅者。流结束或读取失败后序列终止。
	 */
	public Flux<byte[]> inbound() {
		if (this.started.compareAndSet(false, true)) {
			startInboundProcessing();
		}
		return this.inboundSink.asFlux();
	}

	private void startInboundProcessing() {
		this.inboundScheduler.schedule(() -> {
			try (InputStream in = new BufferedInputStream(this.input)) {
				byte[] frame;
				while (!this.isClosing && (frame = readFrame(in)) != null) {
					if (isBlank(frame)) {
						continue;
					}
					if (!this.inboundSink.tryEmitNext(frame).isSuccess()) {
						if (!this.isClosing) {
							logger.error("[{}] Failed to enqueue inbound frame", this.name);
						}
						break;
					}
				}
				logger.debug("[{}] Inbound stream reached end of stream", this.name);
			}
			catch (IOException e) {
				if (!this.isClosing) {
					logger.error("[{}] Error reading from input stream", this.name, e);
					this.inboundSink.tryEmitError(JsonRpcException.transport("Failed to read from " + this.name, e));
				}
			}
			finally {
				this.isClosing = true;
				this.inboundSink.tryEmitComplete();
			}
		});
	}

	/**
	 * 读取到下一个 {@code '\n'} 为止的原始字节，去掉行尾的 {@code '\r'}。字节不经过解码，
	 * 无效的UTF-8由JSON解析器拒绝。
	 * @return 一帧；流已结束且没有剩余字节时返回null
	 */
	private static byte[] readFrame(InputStream in) throws IOException {
		ByteArrayOutputStream line = new ByteArrayOutputStream();
		int b;
		while ((b = in.read()) != -1) {
			if (b == '\n') {
				return stripCarriageReturn(line.toByteArray());
			}
			line.write(b);
		}
		return (line.size() > 0) ? stripCarriageReturn(line.toByteArray()) : null;
	}

	private static byte[] stripCarriageReturn(byte[] line) {
		if (line.length > 0 && line[line.length - 1] == '\r') {
			return Arrays.copyOf(line, line.length - 1);
		}
		return line;
	}

	private static boolean isBlank(byte[] frame) {
		for (byte b : frame) {
			if (b != ' ' && b != '\t' && b != '\r') {
				return false;
			}
		}
		return true;
	}

	/**
	 * 写入一个帧。写入在出站线程上执行；取消订阅会撤销尚未开始的写入。
	 * @param frame 帧字节，不能包含换行符
	 * @return 帧被写出并刷新后完成的Mono
	 */
	public Mono<Void> write(byte[] frame) {
		return Mono.<Void>fromRunnable(() -> {
			if (this.isClosing) {
				throw JsonRpcException.closed(this.name + " is closed");
			}
			for (byte b : frame) {
				if (b == '\n' || b == '\r') {
					throw JsonRpcException.encoding("Frames must not contain embedded newlines", null);
				}
			}
			try {
				synchronized (this.output) {
					this.output.write(frame);
					this.output.write('\n');
					this.output.flush();
				}
			}
			catch (IOException e) {
				throw JsonRpcException.transport("Failed to write frame to " + this.name, e);
			}
		}).subscribeOn(this.outboundScheduler);
	}

	public boolean isClosing() {
		return this.isClosing;
	}

	/**
	 * 等待已排队的写入完成后再关闭。
	 */
	public Mono<Void> closeGracefully() {
		return Mono.<Void>fromRunnable(() -> logger.debug("[{}] Draining outbound frames", this.name))
			.subscribeOn(this.outboundScheduler)
			.publishOn(Schedulers.boundedElastic())
			.then(Mono.fromRunnable(this::close));
	}

	public void close() {
		if (!this.closed.compareAndSet(false, true)) {
			return;
		}
		this.isClosing = true;
		logger.debug("[{}] Closing connection", this.name);
		this.inboundSink.tryEmitComplete();
		closeQuietly(this.input);
		closeQuietly(this.output);
		// the reader thread is blocked in readLine, so only a hard dispose releases it
		this.inboundScheduler.dispose();
		this.outboundScheduler.dispose();
	}

	private void closeQuietly(AutoCloseable closeable) {
		try {
			closeable.close();
		}
		catch (Exception e) {
			logger.warn("[{}] Error closing stream: {}", this.name, e.getMessage());
		}
	}

	@Override
	public String toString() {
		return "LineDelimitedConnection[" + this.name + "]";
	}

}

/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.jsonrpc.server.transport;

import java.io.IOException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

import io.jsonrpc.spec.JsonRpcException;
import io.jsonrpc.spec.JsonRpcServerTransport;
import io.jsonrpc.util.Assert;
import jakarta.servlet.AsyncContext;
import jakarta.servlet.ServletException;
import jakarta.servlet.annotation.WebServlet;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * 基于Servlet的请求/响应服务器传输。
 *
 * <p>
 * 每个发往端点的 {@code POST} 请求体是一个入站帧。请求在异步模式下挂起，直到服务器运行时为该帧给出结果：
 * <ul>
 * <li>有响应时以 {@code 200} 和 {@code application/json} 写回响应体</li>
 * <li>没有响应（通知或被丢弃的帧）时以 {@code 204 No Content} 结束</li>
 * </ul>
 *
 * <p>
 * 这个Servlet需要注册为支持异步（{@code asyncSupported = true}）。关闭后新的请求得到 {@code 503}，
 * 尚未应答的请求同样以 {@code 503} 结束。
 *
 * @see jakarta.servlet.http.HttpServlet
 */
@WebServlet(asyncSupported = true)
public class HttpServletServerTransport extends HttpServlet implements JsonRpcServerTransport {

	/** 该类的日志记录器 */
	private static final Logger logger = LoggerFactory.getLogger(HttpServletServerTransport.class);

	public static final String APPLICATION_JSON = "application/json";

	/** 默认端点路径 */
	public static final String DEFAULT_ENDPOINT = "/rpc";

	/** 处理JSON-RPC帧的端点路径 */
	private final String endpoint;

	private final Sinks.Many<InboundFrame> inboundSink = Sinks.many().unicast().onBackpressureBuffer();

	/** 已接收但尚未应答的帧 */
	private final Set<ServletFrame> inFlight = ConcurrentHashMap.newKeySet();

	/** 指示传输是否正在关闭的标志 */
	private final AtomicBoolean isClosing = new AtomicBoolean(false);

	public HttpServletServerTransport() {
		this(DEFAULT_ENDPOINT);
	}

	public HttpServletServerTransport(String endpoint) {
		Assert.hasText(endpoint, "endpoint must not be empty");
		this.endpoint = endpoint;
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public Flux<InboundFrame> receiveFrames() {
		return this.inboundSink.asFlux();
	}

	@Override
	protected void doPost(HttpServletRequest request, HttpServletResponse response)
			throws ServletException, IOException {

		if (this.isClosing.get()) {
			response.sendError(HttpServletResponse.SC_SERVICE_UNAVAILABLE, "Server is shutting down");
			return;
		}

		String requestURI = request.getRequestURI();
		if (!requestURI.endsWith(this.endpoint)) {
			response.sendError(HttpServletResponse.SC_NOT_FOUND);
			return;
		}

		byte[] payload = request.getInputStream().readAllBytes();

		AsyncContext asyncContext = request.startAsync();
		asyncContext.setTimeout(0);
		ServletFrame frame = new ServletFrame(payload, asyncContext);
		this.inFlight.add(frame);

		Sinks.EmitResult result;
		synchronized (this.inboundSink) {
			result = this.inboundSink.tryEmitNext(frame);
		}
		if (result.isFailure()) {
			logger.warn("Rejecting frame, inbound queue refused it: {}", result);
			frame.finish(HttpServletResponse.SC_SERVICE_UNAVAILABLE, null);
		}
	}

	@Override
	public Mono<Void> closeGracefully() {
		return Mono.fromRunnable(() -> {
			if (!this.isClosing.compareAndSet(false, true)) {
				return;
			}
			logger.debug("Initiating graceful shutdown with {} unanswered frames", this.inFlight.size());
			synchronized (this.inboundSink) {
				this.inboundSink.tryEmitComplete();
			}
			for (ServletFrame frame : Set.copyOf(this.inFlight)) {
				frame.finish(HttpServletResponse.SC_SERVICE_UNAVAILABLE, null);
			}
		});
	}

	@Override
	public void destroy() {
		closeGracefully().block();
		super.destroy();
	}

	/**
	 * 与一个挂起的HTTP请求绑定的入站帧。
	 */
	private class ServletFrame implements InboundFrame {

		private final byte[] payload;

		private final AsyncContext asyncContext;

		private final AtomicBoolean finished = new AtomicBoolean(false);

		ServletFrame(byte[] payload, AsyncContext asyncContext) {
			this.payload = payload;
			this.asyncContext = asyncContext;
		}

		@Override
		public byte[] payload() {
			return this.payload;
		}

		@Override
		public Mono<Void> reply(byte[] response) {
			return Mono.fromRunnable(() -> finish(HttpServletResponse.SC_OK, response));
		}

		@Override
		public Mono<Void> complete() {
			return Mono.fromRunnable(() -> finish(HttpServletResponse.SC_NO_CONTENT, null));
		}

		void finish(int status, byte[] body) {
			if (!this.finished.compareAndSet(false, true)) {
				return;
			}
			inFlight.remove(this);
			try {
				HttpServletResponse response = (HttpServletResponse) this.asyncContext.getResponse();
				response.setStatus(status);
				if (body != null) {
					response.setContentType(APPLICATION_JSON);
					response.setCharacterEncoding("UTF-8");
					response.setContentLength(body.length);
					response.getOutputStream().write(body);
					response.getOutputStream().flush();
				}
			}
			catch (IOException e) {
				throw JsonRpcException.transport("Failed to write HTTP response: " + e.getMessage(), e);
			}
			finally {
				this.asyncContext.complete();
			}
		}

	}

	/**
	 * {@link HttpServletServerTransport} 的构建器。
	 */
	public static class Builder {

		private String endpoint = DEFAULT_ENDPOINT;

		public Builder endpoint(String endpoint) {
			Assert.hasText(endpoint, "endpoint must not be empty");
			this.endpoint = endpoint;
			return this;
		}

		public HttpServletServerTransport build() {
			return new HttpServletServerTransport(this.endpoint);
		}

	}

}

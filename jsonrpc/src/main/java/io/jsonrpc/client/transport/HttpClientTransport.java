/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.jsonrpc.client.transport;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.function.Consumer;

import io.jsonrpc.spec.JsonRpcClientTransport;
import io.jsonrpc.spec.JsonRpcException;
import io.jsonrpc.util.Assert;
import io.jsonrpc.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * 基于HTTP请求/响应的客户端传输。
 *
 * <p>
 * 每个出站帧作为一次 {@code POST} 发送到端点；如果HTTP响应体非空，它就是对应的那一个入站帧。
 * 非2xx状态码是传输错误。这种绑定下一个入站帧恰好对应一个出站帧。
 *
 * <pre>{@code
 * var transport = HttpClientTransport.builder("http://localhost:8080")
 *     .endpoint("/rpc")
 *     .customizeRequest(request -> request.header("Authorization", "Bearer token"))
 *     .build();
 * }</pre>
 */
public class HttpClientTransport implements JsonRpcClientTransport {

	private static final Logger logger = LoggerFactory.getLogger(HttpClientTransport.class);

	private static final String DEFAULT_ENDPOINT = "/rpc";

	private final URI endpointUri;

	private final HttpClient httpClient;

	private final HttpRequest.Builder requestBuilder;

	private final Sinks.Many<byte[]> inboundSink = Sinks.many().unicast().onBackpressureBuffer();

	private volatile boolean isClosing = false;

	HttpClientTransport(HttpClient httpClient, HttpRequest.Builder requestBuilder, String baseUri, String endpoint) {
		Assert.notNull(httpClient, "httpClient must not be null");
		Assert.notNull(requestBuilder, "requestBuilder must not be null");
		Assert.hasText(baseUri, "baseUri must not be empty");
		Assert.hasText(endpoint, "endpoint must not be empty");
		this.httpClient = httpClient;
		this.requestBuilder = requestBuilder;
		this.endpointUri = Utils.resolveUri(URI.create(baseUri), endpoint);
	}

	public static Builder builder(String baseUri) {
		return new Builder(baseUri);
	}

	@Override
	public Mono<Void> sendFrame(byte[] frame) {
		return Mono.defer(() -> {
			if (this.isClosing) {
				return Mono.error(JsonRpcException.closed("HTTP transport to " + this.endpointUri + " is closed"));
			}
			HttpRequest request = this.requestBuilder.copy()
				.uri(this.endpointUri)
				.POST(HttpRequest.BodyPublishers.ofByteArray(frame))
				.build();
			logger.debug("POST {} {}", this.endpointUri, Utils.preview(frame));

			return Mono.fromFuture(() -> this.httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray()))
				.flatMap(response -> {
					if (response.statusCode() / 100 != 2) {
						return Mono.<Void>error(JsonRpcException
							.transport("HTTP " + response.statusCode() + " from " + this.endpointUri, null));
					}
					byte[] body = response.body();
					if (body != null && body.length > 0) {
						emitInbound(body);
					}
					return Mono.<Void>empty();
				})
				.onErrorMap(error -> !(error instanceof JsonRpcException), error -> JsonRpcException
					.transport("Failed to POST frame to " + this.endpointUri + ": " + error.getMessage(), error));
		});
	}

	private void emitInbound(byte[] body) {
		Sinks.EmitResult result;
		synchronized (this.inboundSink) {
			result = this.inboundSink.tryEmitNext(body);
		}
		if (result.isFailure() && !this.isClosing) {
			logger.error("Failed to enqueue inbound frame: {}", result);
		}
	}

	@Override
	public Flux<byte[]> receiveFrames() {
		return this.inboundSink.asFlux();
	}

	@Override
	public Mono<Void> closeGracefully() {
		return Mono.fromRunnable(() -> {
			this.isClosing = true;
			synchronized (this.inboundSink) {
				this.inboundSink.tryEmitComplete();
			}
			logger.debug("HTTP transport to {} closed", this.endpointUri);
		});
	}

	/**
	 * {@link HttpClientTransport} 的构建器。
	 */
	public static class Builder {

		private final String baseUri;

		private String endpoint = DEFAULT_ENDPOINT;

		private HttpClient.Builder clientBuilder = HttpClient.newBuilder()
			.version(HttpClient.Version.HTTP_1_1)
			.connectTimeout(Duration.ofSeconds(10));

		private HttpRequest.Builder requestBuilder = HttpRequest.newBuilder()
			.header("Content-Type", "application/json")
			.header("Accept", "application/json");

		Builder(String baseUri) {
			Assert.hasText(baseUri, "baseUri must not be empty");
			this.baseUri = baseUri;
		}

		public Builder endpoint(String endpoint) {
			Assert.hasText(endpoint, "endpoint must not be empty");
			this.endpoint = endpoint;
			return this;
		}

		public Builder connectTimeout(Duration connectTimeout) {
			Assert.notNull(connectTimeout, "connectTimeout must not be null");
			this.clientBuilder.connectTimeout(connectTimeout);
			return this;
		}

		public Builder clientBuilder(HttpClient.Builder clientBuilder) {
			Assert.notNull(clientBuilder, "clientBuilder must not be null");
			this.clientBuilder = clientBuilder;
			return this;
		}

		public Builder customizeClient(final Consumer<HttpClient.Builder> clientCustomizer) {
			Assert.notNull(clientCustomizer, "clientCustomizer must not be null");
			clientCustomizer.accept(this.clientBuilder);
			return this;
		}

		public Builder customizeRequest(final Consumer<HttpRequest.Builder> requestCustomizer) {
			Assert.notNull(requestCustomizer, "requestCustomizer must not be null");
			requestCustomizer.accept(this.requestBuilder);
			return this;
		}

		public HttpClientTransport build() {
			return new HttpClientTransport(this.clientBuilder.build(), this.requestBuilder, this.baseUri,
					this.endpoint);
		}

	}

}

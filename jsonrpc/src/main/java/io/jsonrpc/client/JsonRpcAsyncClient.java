/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.jsonrpc.client;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jsonrpc.spec.JsonRpcClientSession;
import io.jsonrpc.spec.JsonRpcClientTransport;
import io.jsonrpc.spec.JsonRpcException;
import io.jsonrpc.spec.JsonRpcSession;
import io.jsonrpc.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * 基于Project Reactor的JSON-RPC客户端。
 *
 * <p>
 * 每个调用返回一个冷的 {@link Mono}：只有在订阅时才分配请求ID并发送请求。取消订阅等同于取消调用，
 * 待处理表中的条目随之移除，之后到达的响应被丢弃。
 *
 * <p>
 * 错误以 {@link JsonRpcException} 传递，其 {@link JsonRpcException.Kind} 区分超时、取消、关闭、
 * 传输失败和对端返回的错误响应（{@link io.jsonrpc.spec.JsonRpcError}）。
 *
 * @see JsonRpcClient
 */
public class JsonRpcAsyncClient {

	private static final Logger logger = LoggerFactory.getLogger(JsonRpcAsyncClient.class);

	private final JsonRpcSession session;

	private final ObjectMapper objectMapper;

	JsonRpcAsyncClient(JsonRpcClientTransport transport, Duration requestTimeout, ObjectMapper objectMapper) {
		this(new JsonRpcClientSession(requestTimeout, transport, objectMapper), objectMapper);
	}

	JsonRpcAsyncClient(JsonRpcSession session, ObjectMapper objectMapper) {
		Assert.notNull(session, "Session must not be null");
		Assert.notNull(objectMapper, "ObjectMapper must not be null");
		this.session = session;
		this.objectMapper = objectMapper;
	}

	/**
	 * 调用远程方法并返回原始结果。
	 * @param method 方法名
	 * @param args 按位置排列的参数
	 * @return 结果；结果为 {@code null} 时为空
	 */
	public Mono<JsonNode> call(String method, Object... args) {
		return call(method, toList(args), Mono.never());
	}

	/**
	 * 调用远程方法，直到响应到达、超时、客户端关闭或 {@code cancelSignal} 发出任意信号。
	 * @param method 方法名
	 * @param args 按位置排列的参数
	 * @param cancelSignal 取消信号
	 * @return 结果；结果为 {@code null} 时为空
	 */
	public Mono<JsonNode> call(String method, List<?> args, Mono<?> cancelSignal) {
		return this.session.sendRequest(method, args, cancelSignal).filter(result -> !result.isNull());
	}

	public <T> Mono<T> call(Class<T> resultType, String method, Object... args) {
		return call(this.objectMapper.constructType(resultType), method, toList(args), Mono.never());
	}

	public <T> Mono<T> call(TypeReference<T> resultType, String method, Object... args) {
		return call(this.objectMapper.getTypeFactory().constructType(resultType), method, toList(args), Mono.never());
	}

	<T> Mono<T> call(JavaType resultType, String method, List<?> args, Mono<?> cancelSignal) {
		return call(method, args, cancelSignal).map(result -> convert(result, resultType, method));
	}

	<T> T convert(JsonNode result, JavaType resultType, String method) {
		try {
			return this.objectMapper.treeToValue(result, resultType);
		}
		catch (JsonProcessingException | IllegalArgumentException e) {
			throw JsonRpcException.encoding("Failed to decode result of " + method + " as " + resultType, e);
		}
	}

	/**
	 * 发送通知。通知一经传输层接受即完成。
	 * @param method 方法名
	 * @param args 按位置排列的参数
	 * @return 通知发出后完成的Mono
	 */
	public Mono<Void> sendNotification(String method, Object... args) {
		return this.session.sendNotification(method, toList(args))
			.doOnError(error -> logger.debug("Notification {} failed: {}", method, error.getMessage()));
	}

	ObjectMapper getObjectMapper() {
		return this.objectMapper;
	}

	public Mono<Void> closeGracefully() {
		return this.session.closeGracefully();
	}

	public void close() {
		this.session.close();
	}

	private static List<Object> toList(Object[] args) {
		return (args != null) ? Arrays.asList(args) : List.of();
	}

}

/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.jsonrpc.server;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import io.jsonrpc.spec.JsonRpcError;
import io.jsonrpc.spec.JsonRpcException;
import io.jsonrpc.spec.JsonRpcSchema;
import io.jsonrpc.spec.JsonRpcSchema.JSONRPCResponse;
import io.jsonrpc.util.Assert;
import io.jsonrpc.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * 分发引擎：将一个入站帧变成零个或一个响应。
 *
 * <p>
 * 带有 {@code id} 的消息按请求处理，总是得到一个响应；没有 {@code id} 的消息按通知处理，
 * 永远不会产生出站字节，任何失败都只写入日志。分发本身不做线程切换也不限制时长，
 * 这些由 {@link JsonRpcServer} 负责。
 */
public class JsonRpcDispatcher {

	private static final Logger logger = LoggerFactory.getLogger(JsonRpcDispatcher.class);

	private final CallSiteRegistry registry;

	private final ObjectMapper objectMapper;

	public JsonRpcDispatcher(CallSiteRegistry registry, ObjectMapper objectMapper) {
		Assert.notNull(registry, "Registry must not be null");
		Assert.notNull(objectMapper, "ObjectMapper must not be null");
		this.registry = registry;
		this.objectMapper = objectMapper;
	}

	/**
	 * 分发一个原始帧。
	 * @param frame 请求字节
	 * @return 编码后的响应；通知则为空
	 */
	public Mono<byte[]> dispatch(byte[] frame) {
		return Mono.defer(() -> {
			JsonNode message;
			try {
				message = this.objectMapper.readTree(frame);
			}
			catch (IOException e) {
				logger.debug("Unparseable frame {}: {}", Utils.preview(frame), e.getMessage());
				return Mono.just(JSONRPCResponse.failure(NullNode.instance,
						JsonRpcError.parseError("Parse error").getJsonRpcError()));
			}
			if (message == null || message.isMissingNode()) {
				return Mono.just(JSONRPCResponse.failure(NullNode.instance,
						JsonRpcError.parseError("Parse error: empty frame").getJsonRpcError()));
			}
			return dispatch(message);
		}).map(this::encode);
	}

	/**
	 * 分发一个已解析的消息。
	 * @param message 已解析的JSON消息
	 * @return 请求的响应；通知则为空
	 */
	public Mono<JSONRPCResponse> dispatch(JsonNode message) {
		return Mono.defer(() -> {
			if (!message.isObject()) {
				String reason = message.isArray() ? "batch requests are not supported"
						: "request must be a JSON object";
				return Mono.just(failure(NullNode.instance, JsonRpcError.invalidRequest(reason)));
			}

			JsonNode id = requestId(message);
			JsonNode method = message.get("method");
			JsonNode version = message.get("jsonrpc");
			if (method == null || !method.isTextual() || version == null
					|| !JsonRpcSchema.JSONRPC_VERSION.equals(version.asText())) {
				return reject(id, JsonRpcError.invalidRequest("Invalid request"), message);
			}
			if (id != null && !id.isNumber() && !id.isTextual()) {
				return Mono.just(failure(NullNode.instance, JsonRpcError.invalidRequest("Invalid request id: " + id)));
			}

			String name = method.asText();
			CallSite callSite = this.registry.lookup(name);
			if (callSite == null) {
				return reject(id, JsonRpcError.methodNotFound(name), message);
			}

			List<Object> arguments;
			try {
				arguments = callSite.bind(message.get("params"));
			}
			catch (JsonRpcError e) {
				return reject(id, e, message);
			}

			Mono<JsonNode> invocation = invoke(callSite, arguments);
			if (id == null) {
				return invocation.onErrorResume(error -> {
					logger.error("Notification handler for {} failed", name, error);
					return Mono.empty();
				}).then(Mono.<JSONRPCResponse>empty());
			}
			return invocation.map(result -> JSONRPCResponse.success(id, result)).onErrorResume(error -> {
				logger.debug("Handler for {} (id {}) failed: {}", name, id, error.toString());
				return Mono.just(failure(id, asJsonRpcError(error)));
			});
		});
	}

	/**
	 * 调用处理器。分发被取消（超时或服务器关闭）后处理器抛出的异常已无人接收，只写入日志，
	 * 不交给Reactor的全局丢弃钩子。
	 */
	private Mono<JsonNode> invoke(CallSite callSite, List<Object> arguments) {
		return Mono.create(sink -> {
			AtomicBoolean cancelled = new AtomicBoolean(false);
			sink.onCancel(() -> cancelled.set(true));
			JsonNode result;
			try {
				result = callSite.invoke(arguments);
			}
			catch (Exception e) {
				if (!cancelled.get()) {
					sink.error(e);
					return;
				}
				if (e instanceof InterruptedException) {
					Thread.currentThread().interrupt();
				}
				logger.debug("Handler for {} ended after its dispatch was cancelled: {}", callSite.name(), e.toString());
				return;
			}
			sink.success(result);
		});
	}

	private Mono<JSONRPCResponse> reject(JsonNode id, JsonRpcError error, JsonNode message) {
		if (id == null) {
			logger.warn("Dropping notification {}: {}", message, error.getMessage());
			return Mono.empty();
		}
		return Mono.just(failure(id, error));
	}

	private static JSONRPCResponse failure(JsonNode id, JsonRpcError error) {
		return JSONRPCResponse.failure(id, error.getJsonRpcError());
	}

	/**
	 * 处理器失败映射为线上错误：{@link JsonRpcError} 保留自己的错误码，其他异常为 ServerError，
	 * 消息原样保留。
	 */
	static JsonRpcError asJsonRpcError(Throwable error) {
		if (error instanceof JsonRpcError jsonRpcError) {
			return jsonRpcError;
		}
		String message = (error.getMessage() != null) ? error.getMessage() : error.getClass().getName();
		return JsonRpcError.serverError(message);
	}

	/**
	 * 提取请求ID。
	 * @param message 已解析的消息
	 * @return 请求的ID；如果消息是通知（没有 {@code id} 或为 {@code null}）则返回null
	 */
	public static JsonNode requestId(JsonNode message) {
		JsonNode id = message.get("id");
		return (id == null || id.isNull()) ? null : id;
	}

	/**
	 * 将响应编码为线上字节。
	 * @throws JsonRpcException 类别为 {@link JsonRpcException.Kind#ENCODING}
	 */
	public byte[] encode(JSONRPCResponse response) {
		try {
			return this.objectMapper.writeValueAsBytes(response);
		}
		catch (JsonProcessingException e) {
			throw JsonRpcException.encoding("Failed to encode response " + response.id(), e);
		}
	}

}

/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.jsonrpc.spec;

import java.io.IOException;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import io.jsonrpc.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON-RPC 2.0 的线上消息模型。
 *
 * <p>
 * 包含三种信封：
 * <ul>
 * <li>{@link JSONRPCRequest} - 带有 {@code id}，期望得到响应</li>
 * <li>{@link JSONRPCNotification} - 不带 {@code id}，永远不会得到响应</li>
 * <li>{@link JSONRPCResponse} - 恰好携带 {@code result} 或 {@code error} 之一</li>
 * </ul>
 *
 * @see <a href="https://www.jsonrpc.org/specification">JSON-RPC 2.0 Specification</a>
 */
public final class JsonRpcSchema {

	private static final Logger logger = LoggerFactory.getLogger(JsonRpcSchema.class);

	private JsonRpcSchema() {
	}

	public static final String JSONRPC_VERSION = "2.0";

	// ---------------------------
	// JSON-RPC Error Codes
	// ---------------------------
	/**
	 * 规范保留的错误码。协议错误使用 -32000 及以下的保留区间。
	 */
	public static final class ErrorCodes {

		private ErrorCodes() {
		}

		/**
		 * 服务器收到了无效的JSON。
		 */
		public static final int PARSE_ERROR = -32700;

		/**
		 * 发送的JSON不是有效的请求对象。
		 */
		public static final int INVALID_REQUEST = -32600;

		/**
		 * 方法不存在或不可用。
		 */
		public static final int METHOD_NOT_FOUND = -32601;

		/**
		 * 无效的方法参数。
		 */
		public static final int INVALID_PARAMS = -32602;

		/**
		 * JSON-RPC内部错误。
		 */
		public static final int INTERNAL_ERROR = -32603;

		/**
		 * 处理器报告的应用错误。
		 */
		public static final int SERVER_ERROR = -32000;

	}

	/**
	 * 将原始帧反序列化为具体的 {@link JSONRPCMessage}。分类规则与线上约定一致：
	 * 同时含有 {@code method} 和 {@code id} 的是请求，只含 {@code method} 的是通知，
	 * 含有 {@code result} 或 {@code error} 的是响应。
	 * @param objectMapper 用于反序列化的ObjectMapper
	 * @param frame 原始帧
	 * @return 反序列化后的消息
	 * @throws IOException 如果帧不是有效的JSON
	 * @throws IllegalArgumentException 如果JSON结构不匹配任何已知消息类型
	 */
	public static JSONRPCMessage deserializeJsonRpcMessage(ObjectMapper objectMapper, byte[] frame)
			throws IOException {

		JsonNode node = objectMapper.readTree(frame);
		if (node == null || !node.isObject()) {
			throw new IllegalArgumentException("Cannot deserialize JSONRPCMessage from a non-object frame");
		}

		if (node.has("method") && node.has("id")) {
			return objectMapper.treeToValue(node, JSONRPCRequest.class);
		}
		else if (node.has("method")) {
			return objectMapper.treeToValue(node, JSONRPCNotification.class);
		}
		else if (node.has("result") || node.has("error")) {
			return objectMapper.treeToValue(node, JSONRPCResponse.class);
		}

		logger.debug("Unclassifiable JSON-RPC frame: {}", node);
		throw new IllegalArgumentException("Cannot deserialize JSONRPCMessage: " + node);
	}

	// ---------------------------
	// JSON-RPC Message Types
	// ---------------------------
	public sealed interface JSONRPCMessage permits JSONRPCRequest, JSONRPCNotification, JSONRPCResponse {

		String jsonrpc();

	}

	/**
	 * 期望得到响应的请求。
	 *
	 * @param jsonrpc JSON-RPC版本（必须为"2.0"）
	 * @param method 要调用的方法名
	 * @param id 请求的关联ID
	 * @param params 按位置排列的参数列表，可以缺省
	 */
	@JsonInclude(JsonInclude.Include.NON_NULL)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record JSONRPCRequest( // @formatter:off
		@JsonProperty("jsonrpc") String jsonrpc,
		@JsonProperty("method") String method,
		@JsonProperty("id") Object id,
		@JsonProperty("params") Object params) implements JSONRPCMessage { // @formatter:on

		public JSONRPCRequest {
			Assert.notNull(id, "Requests must carry an id");
		}
	}

	/**
	 * 不期望响应的通知。通知永远不携带 {@code id}。
	 *
	 * @param jsonrpc JSON-RPC版本（必须为"2.0"）
	 * @param method 被通知的方法名
	 * @param params 按位置排列的参数列表，可以缺省
	 */
	@JsonInclude(JsonInclude.Include.NON_NULL)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record JSONRPCNotification( // @formatter:off
		@JsonProperty("jsonrpc") String jsonrpc,
		@JsonProperty("method") String method,
		@JsonProperty("params") Object params) implements JSONRPCMessage { // @formatter:on
	}

	/**
	 * 对请求的响应（成功或错误）。
	 *
	 * <p>
	 * 不变量：{@code result} 与 {@code error} 恰好设置其一。成功且结果为空时，{@code result}
	 * 是 {@link NullNode} 而不是 {@code null}，因此线上仍会写出 {@code "result": null}。
	 * 未知的 {@code id} 同样以 {@link NullNode} 表示。
	 *
	 * @param jsonrpc JSON-RPC版本（必须为"2.0"）
	 * @param id 此响应对应的请求ID
	 * @param result 成功请求的结果；出错时为null
	 * @param error 请求失败时的错误信息；成功时为null
	 */
	@JsonInclude(JsonInclude.Include.NON_NULL)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record JSONRPCResponse( // @formatter:off
		@JsonProperty("jsonrpc") String jsonrpc,
		@JsonProperty("id") JsonNode id,
		@JsonProperty("result") JsonNode result,
		@JsonProperty("error") JSONRPCError error) implements JSONRPCMessage { // @formatter:on

		public JSONRPCResponse {
			Assert.isTrue((result == null) != (error == null),
					"A response must carry exactly one of result or error");
			if (id == null) {
				id = NullNode.instance;
			}
		}

		public static JSONRPCResponse success(JsonNode id, JsonNode result) {
			return new JSONRPCResponse(JSONRPC_VERSION, id, (result != null) ? result : NullNode.instance, null);
		}

		public static JSONRPCResponse failure(JsonNode id, JSONRPCError error) {
			return new JSONRPCResponse(JSONRPC_VERSION, id, null, error);
		}

		/**
		 * A response to a request that indicates an error occurred.
		 *
		 * @param code The error type that occurred
		 * @param message A short description of the error
		 * @param data Additional information about the error, defined by the sender
		 */
		@JsonInclude(JsonInclude.Include.NON_ABSENT)
		@JsonIgnoreProperties(ignoreUnknown = true)
		public record JSONRPCError( // @formatter:off
			@JsonProperty("code") int code,
			@JsonProperty("message") String message,
			@JsonProperty("data") Object data) { // @formatter:on

			public JSONRPCError(int code, String message) {
				this(code, message, null);
			}
		}
	}

	/**
	 * 批量请求产生的响应列表。
	 *
	 * <p>
	 * 这里只定义线上形状：批量请求的执行顺序和原子性均未约定，本运行时也不执行批量请求。
	 * 如果只关心某个请求的响应，使用 {@link #responseOf(Object)}。
	 *
	 * @param responses 响应列表，顺序与到达顺序一致
	 */
	public record BatchResponse(@JsonValue List<JSONRPCResponse> responses) {

		@JsonCreator(mode = JsonCreator.Mode.DELEGATING)
		public BatchResponse {
			Assert.notNull(responses, "Responses must not be null");
			responses = List.copyOf(responses);
		}

		/**
		 * 查找与给定请求ID对应的响应。
		 * @param id 请求ID
		 * @return 匹配的响应；若不存在则返回null
		 */
		public JSONRPCResponse responseOf(Object id) {
			for (JSONRPCResponse response : this.responses) {
				JsonNode responseId = response.id();
				if (responseId.isNumber() && id instanceof Number number
						&& responseId.asLong() == number.longValue()) {
					return response;
				}
				if (responseId.isTextual() && Objects.equals(responseId.asText(), id)) {
					return response;
				}
			}
			return null;
		}

	}

}

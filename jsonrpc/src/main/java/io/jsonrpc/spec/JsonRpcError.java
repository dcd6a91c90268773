/*
 * Copyright 2024 - 2024 原始作者保留所有权利。
 */
package io.jsonrpc.spec;

import io.jsonrpc.spec.JsonRpcSchema.ErrorCodes;
import io.jsonrpc.spec.JsonRpcSchema.JSONRPCResponse.JSONRPCError;

/**
 * 携带线上 {@link JSONRPCError} 的异常。客户端收到错误响应时抛出它；服务器端的处理器也可以
 * 主动抛出它来选择自己的错误码，否则处理器异常一律映射为 {@link ErrorCodes#SERVER_ERROR}。
 */
public class JsonRpcError extends JsonRpcException {

	private final JSONRPCError jsonRpcError;

	public JsonRpcError(JSONRPCError jsonRpcError) {
		super(Kind.REMOTE, jsonRpcError.message());
		this.jsonRpcError = jsonRpcError;
	}

	public JsonRpcError(int code, String message) {
		this(new JSONRPCError(code, message));
	}

	public JSONRPCError getJsonRpcError() {
		return this.jsonRpcError;
	}

	public int getCode() {
		return this.jsonRpcError.code();
	}

	public static JsonRpcError parseError(String message) {
		return new JsonRpcError(ErrorCodes.PARSE_ERROR, message);
	}

	public static JsonRpcError invalidRequest(String message) {
		return new JsonRpcError(ErrorCodes.INVALID_REQUEST, message);
	}

	public static JsonRpcError methodNotFound(String method) {
		return new JsonRpcError(ErrorCodes.METHOD_NOT_FOUND, "Method not found: " + method);
	}

	public static JsonRpcError invalidParams(String message) {
		return new JsonRpcError(ErrorCodes.INVALID_PARAMS, message);
	}

	public static JsonRpcError internalError(String message) {
		return new JsonRpcError(ErrorCodes.INTERNAL_ERROR, message);
	}

	public static JsonRpcError serverError(String message) {
		return new JsonRpcError(ErrorCodes.SERVER_ERROR, message);
	}

}

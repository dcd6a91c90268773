/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.jsonrpc.server;

import java.util.List;

/**
 * 处理器的调用入口。
 *
 * <p>
 * 参数已按 {@link ParameterSpec} 解码并按位置排列。处理器抛出的任何异常都会成为错误响应：
 * {@link io.jsonrpc.spec.JsonRpcError} 保留其错误码，其他异常映射为 ServerError，
 * 消息原样传递给调用方。只有一个输出时返回值即为结果；有多个输出时返回一个
 * {@link List} 或数组，依次对应每个输出。
 */
@FunctionalInterface
public interface MethodHandler {

	Object handle(List<Object> arguments) throws Exception;

}

/*
 * Copyright 2024-2024 原始作者保留所有权利。
 */

package io.jsonrpc.util;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Collection;

import reactor.util.annotation.Nullable;

/**
 * 杂项工具方法。
 */
public final class Utils {

	/** 日志中帧内容的最大字符数 */
	private static final int MAX_LOGGED_FRAME_LENGTH = 256;

	private Utils() {
	}

	/**
	 * 检查给定的{@code String}是否包含实际的<em>文本</em>。
	 * @param str 要检查的{@code String}（可能为{@code null}）
	 * @return 如果{@code String}不为{@code null}且不仅包含空白字符，则返回{@code true}
	 * @see Character#isWhitespace
	 */
	public static boolean hasText(@Nullable String str) {
		return (str != null && !str.isBlank());
	}

	/**
	 * 如果提供的Collection为{@code null}或为空，则返回{@code true}。
	 * @param collection 要检查的Collection
	 * @return 给定的Collection是否为空
	 */
	public static boolean isEmpty(@Nullable Collection<?> collection) {
		return (collection == null || collection.isEmpty());
	}

	/**
	 * 将原始帧解码为UTF-8文本并截断到适合写入日志的长度。
	 * @param frame 原始帧字节（可能为{@code null}）
	 * @return 可读的帧预览
	 */
	public static String preview(@Nullable byte[] frame) {
		if (frame == null) {
			return "null";
		}
		String text = new String(frame, StandardCharsets.UTF_8);
		if (text.length() <= MAX_LOGGED_FRAME_LENGTH) {
			return text;
		}
		return text.substring(0, MAX_LOGGED_FRAME_LENGTH) + "...(" + frame.length + " bytes)";
	}

	/**
	 * 将给定的端点URL相对于基础URL进行解析。
	 * <ul>
	 * <li>如果端点URL是相对的，它将相对于基础URL进行解析。</li>
	 * <li>如果端点URL是绝对的，会验证它是否与基础URL的方案、权限和路径前缀匹配。</li>
	 * <li>如果绝对端点URL的验证失败，则抛出{@link IllegalArgumentException}。</li>
	 * </ul>
	 * @param baseUrl 基础URL（必须是绝对的）
	 * @param endpointUrl 端点URL（可以是相对的或绝对的）
	 * @return 解析后的端点URI
	 * @throws IllegalArgumentException 如果绝对端点URL与基础URL不匹配
	 */
	public static URI resolveUri(URI baseUrl, String endpointUrl) {
		URI endpointUri = URI.create(endpointUrl);
		if (endpointUri.isAbsolute() && !isUnderBaseUri(baseUrl, endpointUri)) {
			throw new IllegalArgumentException("Absolute endpoint URL does not match the base URL.");
		}
		return baseUrl.resolve(endpointUri);
	}

	private static boolean isUnderBaseUri(URI baseUri, URI endpointUri) {
		if (!baseUri.getScheme().equals(endpointUri.getScheme())
				|| !baseUri.getAuthority().equals(endpointUri.getAuthority())) {
			return false;
		}

		String basePath = baseUri.normalize().getPath();
		String endpointPath = endpointUri.normalize().getPath();
		if (basePath.endsWith("/")) {
			basePath = basePath.substring(0, basePath.length() - 1);
		}
		return endpointPath.startsWith(basePath);
	}

}

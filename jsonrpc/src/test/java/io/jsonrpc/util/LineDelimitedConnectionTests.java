/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.jsonrpc.util;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jsonrpc.spec.JsonRpcException;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * {@link LineDelimitedConnection} 测试。
 */
class LineDelimitedConnectionTests {

	private static byte[] bytes(String text) {
		return text.getBytes(StandardCharsets.UTF_8);
	}

	@Test
	void inboundSplitsOnNewlinesAndSkipsBlankLines() {
		LineDelimitedConnection connection = new LineDelimitedConnection("test",
				new ByteArrayInputStream(bytes("{\"a\":1}\n\n  \n{\"b\":2}\n")), new ByteArrayOutputStream());

		StepVerifier.create(connection.inbound().map(frame -> new String(frame, StandardCharsets.UTF_8)))
			.expectNext("{\"a\":1}")
			.expectNext("{\"b\":2}")
			.expectComplete()
			.verify(Duration.ofSeconds(5));

		connection.close();
	}

	@Test
	void inboundBytesAreNotDecoded() {
		byte[] invalidUtf8 = { '{', '"', 'a', '"', ':', '"', (byte) 0xFF, '"', '}' };
		byte[] input = Arrays.copyOf(invalidUtf8, invalidUtf8.length + 2);
		input[invalidUtf8.length] = '\r';
		input[invalidUtf8.length + 1] = '\n';
		LineDelimitedConnection connection = new LineDelimitedConnection("raw", new ByteArrayInputStream(input),
				new ByteArrayOutputStream());

		StepVerifier.create(connection.inbound())
			.assertNext(frame -> {
				assertThat(frame).containsExactly(invalidUtf8);
				assertThatThrownBy(() -> new ObjectMapper().readTree(frame)).isInstanceOf(JsonParseException.class);
			})
			.expectComplete()
			.verify(Duration.ofSeconds(5));

		connection.close();
	}

	@Test
	void lastLineWithoutNewlineIsDelivered() {
		LineDelimitedConnection connection = new LineDelimitedConnection("tail",
				new ByteArrayInputStream(bytes("{\"a\":1}\n{\"b\":2}")), new ByteArrayOutputStream());

		StepVerifier.create(connection.inbound().map(frame -> new String(frame, StandardCharsets.UTF_8)))
			.expectNext("{\"a\":1}", "{\"b\":2}")
			.expectComplete()
			.verify(Duration.ofSeconds(5));

		connection.close();
	}

	@Test
	void readFailureTerminatesWithTransportError() {
		InputStream failing = new InputStream() {
			@Override
			public int read() throws IOException {
				throw new IOException("boom");
			}
		};
		LineDelimitedConnection connection = new LineDelimitedConnection("failing", failing,
				new ByteArrayOutputStream());

		StepVerifier.create(connection.inbound())
			.expectErrorSatisfies(error -> assertThat(error).isInstanceOfSatisfying(JsonRpcException.class,
					e -> assertThat(e.getKind()).isEqualTo(JsonRpcException.Kind.TRANSPORT)))
			.verify(Duration.ofSeconds(5));

		connection.close();
	}

	@Test
	void writeAppendsNewline() {
		ByteArrayOutputStream output = new ByteArrayOutputStream();
		LineDelimitedConnection connection = new LineDelimitedConnection("writer", new ByteArrayInputStream(new byte[0]),
				output);

		connection.write(bytes("{\"x\":1}")).block(Duration.ofSeconds(5));
		connection.write(bytes("{\"y\":2}")).block(Duration.ofSeconds(5));

		assertThat(output.toString(StandardCharsets.UTF_8)).isEqualTo("{\"x\":1}\n{\"y\":2}\n");
		connection.close();
	}

	@Test
	void embeddedNewlineIsRejected() {
		ByteArrayOutputStream output = new ByteArrayOutputStream();
		LineDelimitedConnection connection = new LineDelimitedConnection("writer", new ByteArrayInputStream(new byte[0]),
				output);

		StepVerifier.create(connection.write(bytes("{\"x\":\n1}")))
			.expectErrorSatisfies(error -> assertThat(error).isInstanceOfSatisfying(JsonRpcException.class,
					e -> assertThat(e.getKind()).isEqualTo(JsonRpcException.Kind.ENCODING)))
			.verify(Duration.ofSeconds(5));
		assertThat(output.size()).isZero();
		connection.close();
	}

	@Test
	void writeAfterCloseFails() {
		LineDelimitedConnection connection = new LineDelimitedConnection("closed",
				new ByteArrayInputStream(new byte[0]), new ByteArrayOutputStream());
		connection.close();
		connection.close();

		assertThat(connection.isClosing()).isTrue();
		StepVerifier.create(connection.write(bytes("{}"))).expectError().verify(Duration.ofSeconds(5));
	}

}

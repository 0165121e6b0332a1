/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.toolwire.spec;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import io.toolwire.json.McpJsonMapper;
import io.toolwire.json.TypeRef;
import io.toolwire.spec.McpSchema.JSONRPCBatch;
import io.toolwire.spec.McpSchema.JSONRPCNotification;
import io.toolwire.spec.McpSchema.JSONRPCPayload;
import io.toolwire.spec.McpSchema.JSONRPCRequest;
import io.toolwire.spec.McpSchema.JSONRPCResponse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.InstanceOfAssertFactories.type;

class McpMessageCodecTests {

	private final McpMessageCodec codec = new McpMessageCodec(McpJsonMapper.getDefault());

	@Test
	void decodesRequest() {
		JSONRPCPayload payload = this.codec
			.decode("{\"jsonrpc\":\"2.0\",\"id\":7,\"method\":\"tools/call\",\"params\":{\"name\":\"echo\"}}");

		assertThat(payload).asInstanceOf(type(JSONRPCRequest.class)).satisfies(request -> {
			assertThat(request.method()).isEqualTo("tools/call");
			assertThat(request.id()).isEqualTo(7L);
			assertThat(request.params()).isEqualTo(Map.of("name", "echo"));
		});
	}

	@Test
	void decodesNotificationWithoutId() {
		JSONRPCPayload payload = this.codec.decode("{\"jsonrpc\":\"2.0\",\"method\":\"notifications/initialized\"}");

		assertThat(payload).isInstanceOf(JSONRPCNotification.class);
		assertThat(((JSONRPCNotification) payload).params()).isNull();
	}

	@Test
	void decodesErrorResponse() {
		JSONRPCPayload payload = this.codec.decode(
				"{\"jsonrpc\":\"2.0\",\"id\":\"abc\",\"error\":{\"code\":-32000,\"message\":\"tool not found: x\",\"data\":{\"k\":1}}}");

		assertThat(payload).asInstanceOf(type(JSONRPCResponse.class)).satisfies(response -> {
			assertThat(response.hasError()).isTrue();
			assertThat(response.id()).isEqualTo("abc");
			assertThat(response.error().code()).isEqualTo(McpSchema.ErrorCodes.TOOL_NOT_FOUND);
			assertThat(response.error().message()).isEqualTo("tool not found: x");
			assertThat(response.error().data()).isEqualTo(Map.of("k", 1));
		});
	}

	@Test
	void decodesBatchInWireOrder() {
		JSONRPCPayload payload = this.codec.decode("[{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"ping\"},"
				+ "{\"jsonrpc\":\"2.0\",\"method\":\"notifications/initialized\"},"
				+ "{\"jsonrpc\":\"2.0\",\"id\":2,\"result\":{}}]");

		assertThat(payload).asInstanceOf(type(JSONRPCBatch.class))
			.extracting(JSONRPCBatch::messages)
			.satisfies(messages -> {
				assertThat(messages).hasSize(3);
				assertThat(messages.get(0)).isInstanceOf(JSONRPCRequest.class);
				assertThat(messages.get(1)).isInstanceOf(JSONRPCNotification.class);
				assertThat(messages.get(2)).isInstanceOf(JSONRPCResponse.class);
			});
	}

	@Test
	void encodesBatchAsArray() {
		String frame = this.codec.encode(new JSONRPCBatch(List.of(JSONRPCResponse.success(1, Map.of()),
				new JSONRPCNotification("notifications/tools/list_changed", null))));

		assertThat(frame).startsWith("[").endsWith("]");
		assertThat(this.codec.decode(frame)).asInstanceOf(type(JSONRPCBatch.class))
			.extracting(batch -> batch.messages().size())
			.isEqualTo(2);
	}

	@Test
	void encodedErrorResponseKeepsNullId() {
		String frame = this.codec.encode(JSONRPCResponse.failure(null,
				new JSONRPCResponse.JSONRPCError(McpSchema.ErrorCodes.PARSE_ERROR, "Parse error", null)));

		assertThat(frame).contains("\"id\":null").doesNotContain("\"result\"");
	}

	@Test
	void invalidJsonIsParseError() {
		assertThatThrownBy(() -> this.codec.decode("{\"jsonrpc\": \"2.0\", \"method\""))
			.isInstanceOfSatisfying(McpCodecException.class, e -> {
				assertThat(e.isParseError()).isTrue();
				assertThat(e.getCode()).isEqualTo(McpSchema.ErrorCodes.PARSE_ERROR);
				assertThat(e.getRequestId()).isNull();
			});
	}

	@Test
	void emptyFrameIsParseError() {
		assertThatThrownBy(() -> this.codec.decode("  ")).isInstanceOfSatisfying(McpCodecException.class,
				e -> assertThat(e.isParseError()).isTrue());
	}

	@Test
	void emptyBatchIsInvalidRequest() {
		assertThatThrownBy(() -> this.codec.decode("[]")).isInstanceOfSatisfying(McpCodecException.class, e -> {
			assertThat(e.getCode()).isEqualTo(McpSchema.ErrorCodes.INVALID_REQUEST);
			assertThat(e.getMessage()).contains("empty batch");
		});
	}

	@Test
	void invalidBatchMemberRejectsTheWholeBatch() {
		assertThatThrownBy(() -> this.codec
			.decode("[{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"ping\"},{\"jsonrpc\":\"1.0\",\"id\":2,\"method\":\"ping\"}]"))
			.isInstanceOfSatisfying(McpCodecException.class, e -> {
				assertThat(e.getCode()).isEqualTo(McpSchema.ErrorCodes.INVALID_REQUEST);
				assertThat(e.getRequestId()).isNull();
			});
	}

	@Test
	void wrongVersionKeepsRecoverableId() {
		assertThatThrownBy(() -> this.codec.decode("{\"jsonrpc\":\"1.0\",\"id\":42,\"method\":\"ping\"}"))
			.isInstanceOfSatisfying(McpCodecException.class, e -> {
				assertThat(e.getCode()).isEqualTo(McpSchema.ErrorCodes.INVALID_REQUEST);
				assertThat(e.getRequestId()).isEqualTo(42L);
				assertThat(e.toResponse().id()).isEqualTo(42L);
			});
	}

	@Test
	void nonObjectFrameIsInvalidRequest() {
		assertThatThrownBy(() -> this.codec.decode("42")).isInstanceOfSatisfying(McpCodecException.class,
				e -> assertThat(e.getCode()).isEqualTo(McpSchema.ErrorCodes.INVALID_REQUEST));
	}

	@Test
	void emptyMethodIsInvalidRequest() {
		assertThatThrownBy(() -> this.codec.decode("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"\"}"))
			.isInstanceOf(McpCodecException.class)
			.hasMessageContaining("method must be a non-empty string");
	}

	@Test
	void scalarParamsAreInvalidRequest() {
		assertThatThrownBy(() -> this.codec.decode("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"ping\",\"params\":3}"))
			.isInstanceOf(McpCodecException.class)
			.hasMessageContaining("params must be an object or an array");
	}

	@Test
	void fractionalIdIsInvalidRequest() {
		assertThatThrownBy(() -> this.codec.decode("{\"jsonrpc\":\"2.0\",\"id\":1.5,\"method\":\"ping\"}"))
			.isInstanceOfSatisfying(McpCodecException.class, e -> {
				assertThat(e.getRequestId()).isNull();
				assertThat(e.getMessage()).contains("id must be a string or an integer");
			});
	}

	@Test
	void responseWithResultAndErrorIsInvalidRequest() {
		assertThatThrownBy(() -> this.codec
			.decode("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{},\"error\":{\"code\":1,\"message\":\"x\"}}"))
			.isInstanceOf(McpCodecException.class)
			.hasMessageContaining("must not carry both result and error");
	}

	@Test
	void errorWithoutMessageIsInvalidRequest() {
		assertThatThrownBy(() -> this.codec.decode("{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":-32000}}"))
			.isInstanceOf(McpCodecException.class)
			.hasMessageContaining("integer code and a string message");
	}

	@Test
	void frameWithoutMethodResultOrErrorIsInvalidRequest() {
		assertThatThrownBy(() -> this.codec.decode("{\"jsonrpc\":\"2.0\",\"id\":1}"))
			.isInstanceOf(McpCodecException.class)
			.hasMessageContaining("missing method");
	}

	@Test
	void unmarshalBindsParams() {
		McpSchema.CallToolRequest request = this.codec.unmarshal(Map.of("name", "echo", "arguments", Map.of("x", 1)),
				new TypeRef<McpSchema.CallToolRequest>() {
				});

		assertThat(request.name()).isEqualTo("echo");
		assertThat(request.arguments()).containsEntry("x", 1);
	}

	@Test
	void unmarshalOfWrongShapeIsInvalidParams() {
		assertThatThrownBy(() -> this.codec.unmarshal(List.of(1, 2), McpSchema.CallToolRequest.class))
			.isInstanceOfSatisfying(McpError.class,
					e -> assertThat(e.getCode()).isEqualTo(McpSchema.ErrorCodes.INVALID_PARAMS))
			.hasMessageStartingWith("Invalid params: ");
	}

	@Test
	void everyEnvelopeKindSurvivesEncodeAndDecode() {
		List<JSONRPCPayload> payloads = List.of(new JSONRPCRequest("tools/call", 5L, Map.of("name", "echo")),
				new JSONRPCRequest("ping", "req-1", null),
				new JSONRPCNotification("notifications/progress", Map.of("progress", 1)),
				JSONRPCResponse.success(3L, Map.of("ok", true)),
				JSONRPCResponse.failure(null, new JSONRPCResponse.JSONRPCError(-32700, "Parse error", null)),
				new JSONRPCBatch(List.of(new JSONRPCRequest("ping", 1L, null),
						new JSONRPCNotification("notifications/initialized", null), JSONRPCResponse.success("r", "done"),
						JSONRPCResponse.failure(2L,
								new JSONRPCResponse.JSONRPCError(-32601, "Method not found: bogus", null)))));

		for (JSONRPCPayload payload : payloads) {
			assertThat(this.codec.decode(this.codec.encode(payload))).isEqualTo(payload);
		}
	}

	@Test
	void integerAndLongIdsAreTheSameId() {
		assertThat(new JSONRPCRequest("ping", 5, null)).isEqualTo(new JSONRPCRequest("ping", 5L, null));
		assertThat(JSONRPCResponse.success(3, null)).isEqualTo(JSONRPCResponse.success(3L, null));
	}

}

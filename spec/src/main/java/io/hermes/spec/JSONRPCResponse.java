package io.hermes.spec;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import org.jspecify.annotations.Nullable;

/**
 * A JSON-RPC 2.0 response carrying either a result or an error, and the id of the request it answers.
 * <p>
 * Serialises with exactly one of {@code result} and {@code error}; a successful response keeps an
 * explicit {@code "result": null}.
 *
 * @param jsonrpc the protocol version
 * @param id the id of the request, {@code null} when it could not be determined
 * @param result the method result on success
 * @param error the error on failure
 */
@JsonSerialize(using = JSONRPCResponse.Serializer.class)
public record JSONRPCResponse(String jsonrpc, @Nullable Object id, @Nullable Object result,
                              @Nullable JSONRPCError error) {

    public static JSONRPCResponse success(@Nullable Object id, @Nullable Object result) {
        return new JSONRPCResponse(JSONRPCRequest.JSONRPC_VERSION, id, result, null);
    }

    public static JSONRPCResponse failure(@Nullable Object id, A2AError error) {
        return new JSONRPCResponse(JSONRPCRequest.JSONRPC_VERSION, id, null, error.toJSONRPCError());
    }

    public boolean isError() {
        return error != null;
    }

    public static final class Serializer extends StdSerializer<JSONRPCResponse> {

        public Serializer() {
            super(JSONRPCResponse.class);
        }

        @Override
        public void serialize(JSONRPCResponse value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeStartObject();
            gen.writeStringField("jsonrpc", value.jsonrpc());
            if (value.error() != null) {
                provider.defaultSerializeField("error", value.error(), gen);
            } else {
                gen.writeFieldName("result");
                provider.defaultSerializeValue(value.result(), gen);
            }
            gen.writeFieldName("id");
            provider.defaultSerializeValue(value.id(), gen);
            gen.writeEndObject();
        }
    }
}

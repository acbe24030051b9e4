package com.questrail.bmux.header;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.bmux.error.ConfigurationException;
import com.questrail.bmux.error.HeaderDecodeException;
import com.questrail.bmux.error.HeaderSchemaException;

import java.io.IOException;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

/**
 * SelfDescribingSchema
 * -----------------------------------------------------------------------------
 * Header schema for payloads that carry their own structure, encoded as a
 * JSON object and bound with Jackson.
 *
 * <p>The message id is the top-level field whose name normalizes to
 * {@code msgid} (case-insensitive, {@code _} and {@code -} removed), so
 * {@code "msgId"}, {@code "msg_id"} and {@code "MSG-ID"} all qualify. Its value
 * must be an integral JSON number within the signed 32-bit range.</p>
 */
public final class SelfDescribingSchema<H> implements HeaderSchema<H>
{
    private final ObjectMapper mapper;
    private final Class<H> type;

    private SelfDescribingSchema(ObjectMapper mapper, Class<H> type)
    {
        this.mapper = mapper;
        this.type = type;
    }

    /**
     * Schema using a default mapper that ignores unknown properties.
     */
    public static <H> SelfDescribingSchema<H> json(Class<H> type)
    {
        ObjectMapper mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return json(type, mapper);
    }

    public static <H> SelfDescribingSchema<H> json(Class<H> type, ObjectMapper mapper)
    {
        if (type == null) {
            throw new ConfigurationException("Header type must not be null");
        }
        if (mapper == null) {
            throw new ConfigurationException("ObjectMapper must not be null");
        }
        return new SelfDescribingSchema<>(mapper, type);
    }

    public Class<H> type()
    {
        return type;
    }

    @Override
    public DecodedHeader<H> decode(byte[] rawHead)
    {
        Objects.requireNonNull(rawHead, "rawHead");

        final JsonNode tree;
        try {
            tree = mapper.readTree(rawHead);
        }
        catch (IOException e) {
            throw new HeaderDecodeException("Malformed self-describing header: " + e.getMessage(), e);
        }
        if (tree == null || !tree.isObject()) {
            throw new HeaderDecodeException("Self-describing header is not a JSON object");
        }

        final H header;
        try {
            header = mapper.treeToValue(tree, type);
        }
        catch (JsonProcessingException e) {
            throw new HeaderDecodeException(
                    "Cannot bind header to " + type.getSimpleName() + ": " + e.getOriginalMessage(), e);
        }
        if (header == null) {
            throw new HeaderDecodeException("Header bound to null " + type.getSimpleName());
        }

        return new DecodedHeader<>(messageId(tree), header);
    }

    private static int messageId(JsonNode tree)
    {
        Iterator<Map.Entry<String, JsonNode>> it = tree.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> field = it.next();
            if (!MessageIds.ID_FIELD.equals(MessageIds.normalize(field.getKey()))) {
                continue;
            }
            JsonNode value = field.getValue();
            if (!value.isIntegralNumber()) {
                throw new HeaderDecodeException(
                        "Message id field '" + field.getKey() + "' is " + value.getNodeType() + ", not an integer");
            }
            return MessageIds.narrow(value.bigIntegerValue(), field.getKey());
        }
        throw new HeaderSchemaException("Self-describing header has no field named like 'msgid'");
    }
}

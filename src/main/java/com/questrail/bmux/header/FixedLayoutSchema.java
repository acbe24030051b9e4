package com.questrail.bmux.header;

import com.questrail.bmux.error.ConfigurationException;
import com.questrail.bmux.error.HeaderDecodeException;
import com.questrail.bmux.error.HeaderSchemaException;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * FixedLayoutSchema
 * -----------------------------------------------------------------------------
 * Header schema built from an explicit, ordered field list.
 *
 * <p>Fields are decoded in declaration order with fixed-width big-endian
 * codecs. Exactly one field carries the message-id role; the identifier is
 * chosen by that role, never by the field's name.</p>
 *
 * <pre>{@code
 * FixedLayoutSchema<LoginHeader> schema = FixedLayoutSchema.builder(LoginHeader::new)
 *         .field("version", FieldKind.UINT8, (h, v) -> h.version = (int) v)
 *         .messageId("msgId", FieldKind.UINT16, (h, v) -> h.msgId = (int) v)
 *         .field("sequence", FieldKind.UINT32, (h, v) -> h.sequence = v)
 *         .build();
 * }</pre>
 *
 * <p>Trailing bytes after the last declared field are ignored.</p>
 */
public final class FixedLayoutSchema<H> implements HeaderSchema<H>
{
    private final Supplier<H> factory;
    private final List<Field<H>> fields;

    private FixedLayoutSchema(Supplier<H> factory, List<Field<H>> fields)
    {
        this.factory = factory;
        this.fields = List.copyOf(fields);
    }

    public static <H> Builder<H> builder(Supplier<H> factory)
    {
        return new Builder<>(factory);
    }

    public List<Field<H>> fields()
    {
        return fields;
    }

    /**
     * Number of bytes the declared layout occupies.
     */
    public int layoutWidth()
    {
        int width = 0;
        for (Field<H> f : fields) {
            width += f.kind().width();
        }
        return width;
    }

    @Override
    public DecodedHeader<H> decode(byte[] rawHead)
    {
        Objects.requireNonNull(rawHead, "rawHead");

        H header = factory.get();
        if (header == null) {
            throw new ConfigurationException("Header factory returned null");
        }

        ByteBuffer buf = ByteBuffer.wrap(rawHead).order(ByteOrder.BIG_ENDIAN);
        Integer messageId = null;

        for (Field<H> f : fields) {
            if (!f.kind().decodable()) {
                throw new HeaderDecodeException(
                        "Unsupported field kind " + f.kind() + " for field '" + f.name() + "'");
            }
            if (buf.remaining() < f.kind().width()) {
                throw new HeaderDecodeException(
                        "Header too short for field '" + f.name() + "': need " + f.kind().width()
                                + " byte(s), " + buf.remaining() + " left");
            }

            long value = f.kind().read(buf);
            f.setter().set(header, value);

            if (f.role() == FieldRole.MESSAGE_ID) {
                messageId = MessageIds.narrow(value, f.name());
            }
        }

        // build() guarantees the role is present
        return new DecodedHeader<>(messageId, header);
    }

    /**
     * Role a field plays in the layout.
     */
    public enum FieldRole
    {
        DATA,
        MESSAGE_ID
    }

    /**
     * Stores a decoded value into the header. Values are widened to
     * {@code long}; unsigned kinds arrive zero-extended.
     */
    @FunctionalInterface
    public interface FieldSetter<H>
    {
        void set(H header, long value);
    }

    public record Field<H>(String name, FieldKind kind, FieldRole role, FieldSetter<H> setter)
    {
        public Field
        {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(role, "role");
            Objects.requireNonNull(setter, "setter");
        }
    }

    public static final class Builder<H>
    {
        private final Supplier<H> factory;
        private final List<Field<H>> fields = new ArrayList<>();

        private Builder(Supplier<H> factory)
        {
            if (factory == null) {
                throw new ConfigurationException("Header factory must not be null");
            }
            this.factory = factory;
        }

        public Builder<H> field(String name, FieldKind kind, FieldSetter<H> setter)
        {
            fields.add(new Field<>(name, kind, FieldRole.DATA, setter));
            return this;
        }

        public Builder<H> messageId(String name, FieldKind kind, FieldSetter<H> setter)
        {
            fields.add(new Field<>(name, kind, FieldRole.MESSAGE_ID, setter));
            return this;
        }

        /**
         * Skip {@code width} bytes of padding.
         */
        public Builder<H> padding(int width)
        {
            if (width <= 0) {
                throw new IllegalArgumentException("Padding width must be positive");
            }
            for (int i = 0; i < width; i++) {
                fields.add(new Field<>("padding", FieldKind.UINT8, FieldRole.DATA, (h, v) -> {}));
            }
            return this;
        }

        /**
         * @throws HeaderSchemaException if no field, or more than one field,
         *         carries the message-id role
         */
        public FixedLayoutSchema<H> build()
        {
            long ids = fields.stream().filter(f -> f.role() == FieldRole.MESSAGE_ID).count();
            if (ids == 0) {
                throw new HeaderSchemaException("Fixed layout declares no message id field");
            }
            if (ids > 1) {
                throw new HeaderSchemaException("Fixed layout declares " + ids + " message id fields");
            }
            return new FixedLayoutSchema<>(factory, fields);
        }
    }
}

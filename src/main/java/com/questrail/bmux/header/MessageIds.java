package com.questrail.bmux.header;

import com.questrail.bmux.error.HeaderDecodeException;

import java.math.BigInteger;
import java.util.Locale;

/**
 * Message id helpers shared by both schema variants.
 *
 * <p>Narrowing is range-checked: a value that does not fit a signed 32-bit
 * integer is rejected rather than wrapped or saturated.</p>
 */
final class MessageIds
{
    /** Normalized name of the self-describing identifier field. */
    static final String ID_FIELD = "msgid";

    private static final BigInteger MIN = BigInteger.valueOf(Integer.MIN_VALUE);
    private static final BigInteger MAX = BigInteger.valueOf(Integer.MAX_VALUE);

    private MessageIds() {}

    static int narrow(long value, String field)
    {
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new HeaderDecodeException(
                    "Message id " + value + " in field '" + field + "' does not fit in 32 bits");
        }
        return (int) value;
    }

    static int narrow(BigInteger value, String field)
    {
        if (value.compareTo(MIN) < 0 || value.compareTo(MAX) > 0) {
            throw new HeaderDecodeException(
                    "Message id " + value + " in field '" + field + "' does not fit in 32 bits");
        }
        return value.intValue();
    }

    /**
     * Case-insensitive, with {@code _} and {@code -} removed.
     * {@code "Msg_Id"}, {@code "msg-id"} and {@code "MSGID"} all normalize to {@code "msgid"}.
     */
    static String normalize(String name)
    {
        StringBuilder sb = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c != '_' && c != '-') {
                sb.append(c);
            }
        }
        return sb.toString().toLowerCase(Locale.ROOT);
    }
}

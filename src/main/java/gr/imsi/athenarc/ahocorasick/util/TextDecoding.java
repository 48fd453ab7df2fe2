package gr.imsi.athenarc.ahocorasick.util;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Preconditions;

/**
 * UTF-8 decoding for byte input. Malformed or unmappable sequences become U+FFFD
 * instead of aborting the decode.
 */
public class TextDecoding {

    public static final int REPLACEMENT_CODE_POINT = 0xFFFD;

    public static String decode(byte[] bytes) {
        Preconditions.checkNotNull(bytes, "Input bytes must not be null.");
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPLACE)
            .onUnmappableCharacter(CodingErrorAction.REPLACE)
            .replaceWith("\uFFFD");
        try {
            return decoder.decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            // REPLACE never reports coding errors
            throw new IllegalStateException("Unexpected UTF-8 decoding failure", e);
        }
    }

    public static List<String> decodeAll(List<byte[]> byteStrings) {
        Preconditions.checkNotNull(byteStrings, "Dictionary must not be null.");
        List<String> decoded = new ArrayList<>(byteStrings.size());
        for (int i = 0; i < byteStrings.size(); i++) {
            byte[] bytes = byteStrings.get(i);
            Preconditions.checkNotNull(bytes, "Pattern at index %s is null.", i);
            decoded.add(decode(bytes));
        }
        return decoded;
    }

    public static int codePointLength(String text) {
        return text.codePointCount(0, text.length());
    }
}

package io.restspy.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.zip.GZIPInputStream;
import java.util.zip.Inflater;
import java.util.zip.InflaterInputStream;
import java.util.zip.ZipException;

/**
 * Built-in {@link ContentDecoder}s.
 */
public final class ContentDecoders {

    private static final Logger log = LoggerFactory.getLogger(ContentDecoders.class);

    private static final ContentDecoder IDENTITY = (body, contentEncoding) -> body;
    private static final ContentDecoder STANDARD = ContentDecoders::decodeStandard;

    private ContentDecoders() {}

    /**
     * Returns a decoder that ignores the header and hands the body back unchanged.
     */
    public static ContentDecoder identity() {
        return IDENTITY;
    }

    /**
     * Returns a decoder for {@code gzip}, {@code x-gzip}, {@code deflate} and {@code identity}.
     *
     * <p>A list of codings such as {@code "deflate, gzip"} is undone from last to first.
     * Unknown codings leave the body unchanged.
     */
    public static ContentDecoder standard() {
        return STANDARD;
    }

    private static byte[] decodeStandard(byte[] body, String contentEncoding) {
        if (contentEncoding == null || contentEncoding.isBlank() || body.length == 0) {
            return body;
        }

        String[] codings = contentEncoding.split(",");
        byte[] out = body;
        for (int i = codings.length - 1; i >= 0; i--) {
            String coding = codings[i].trim().toLowerCase(Locale.ROOT);
            out = decodeOne(out, coding, contentEncoding);
        }
        return out;
    }

    private static byte[] decodeOne(byte[] body, String coding, String header) {
        try {
            switch (coding) {
                case "gzip", "x-gzip" -> {
                    return readAll(new GZIPInputStream(new ByteArrayInputStream(body)));
                }
                case "deflate" -> {
                    return inflate(body);
                }
                case "", "identity" -> {
                    return body;
                }
                default -> {
                    log.debug("Unsupported content coding '{}', leaving body unchanged", coding);
                    return body;
                }
            }
        } catch (IOException e) {
            throw new RestSpyException.ContentDecoding(header, e);
        }
    }

    // Servers disagree on whether "deflate" carries the zlib wrapper.
    private static byte[] inflate(byte[] body) throws IOException {
        try {
            return readAll(new InflaterInputStream(new ByteArrayInputStream(body)));
        } catch (ZipException e) {
            return readAll(new InflaterInputStream(new ByteArrayInputStream(body), new Inflater(true)));
        }
    }

    private static byte[] readAll(InputStream in) throws IOException {
        try (in) {
            return in.readAllBytes();
        }
    }
}

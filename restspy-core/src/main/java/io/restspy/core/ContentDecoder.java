package io.restspy.core;

/**
 * Undoes the content coding named by a {@code Content-Encoding} header.
 */
@FunctionalInterface
public interface ContentDecoder {

    /**
     * Decodes a body.
     *
     * @param body the body as received, never null
     * @param contentEncoding the header value, or null when the header is absent
     * @return the decoded body
     * @throws RestSpyException.ContentDecoding if the body is not valid for the coding
     */
    byte[] decode(byte[] body, String contentEncoding);
}

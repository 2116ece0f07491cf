package org.accesstwin.consult.gateway.stream;

/**
 * Decodes one line of a streaming wire dialect.
 */
@FunctionalInterface
public interface LineDecoder {

    /**
     * @param line one line with the terminator stripped; never null
     * @throws MalformedLineException if the line cannot be parsed
     */
    DecodedLine decode(String line) throws MalformedLineException;
}

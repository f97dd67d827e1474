package com.dnobretech.jarvisepubconverter.dto;

import java.util.List;

/**
 * ZIP final entregue ao cliente; {@code fileNames} segue a ordem dos uploads.
 */
public record OuterBundle(byte[] content, List<String> fileNames) {
}

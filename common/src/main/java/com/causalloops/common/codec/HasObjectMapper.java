package com.causalloops.common.codec;

import com.fasterxml.jackson.databind.ObjectMapper;

/** Codecs backed by Jackson expose their mapper so callers can build trees with the same settings. */
public interface HasObjectMapper {
    ObjectMapper objectMapper();
}

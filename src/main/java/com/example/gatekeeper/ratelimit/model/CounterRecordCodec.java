package com.example.gatekeeper.ratelimit.model;

import com.example.gatekeeper.ratelimit.store.CounterStoreException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

/**
 * 카운터 레코드 직렬화/역직렬화 (JSON, UTF-8)
 *
 * 손상된 레코드는 CounterStoreException 으로 던져서 엔진이 fail-open 하도록 한다.
 */
public class CounterRecordCodec {

    private final ObjectMapper objectMapper;

    public CounterRecordCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public byte[] encode(Object record) {
        try {
            return objectMapper.writeValueAsBytes(record);
        } catch (JsonProcessingException e) {
            throw new CounterStoreException("Failed to encode counter record: " + record.getClass().getSimpleName(), e);
        }
    }

    //저장된 값이 없으면 null 반환
    public <T> T decode(byte[] bytes, Class<T> type) {
        if (bytes == null) {
            return null;
        }
        try {
            return objectMapper.readValue(bytes, type);
        } catch (IOException e) {
            throw new CounterStoreException("Failed to decode counter record as " + type.getSimpleName(), e);
        }
    }
}

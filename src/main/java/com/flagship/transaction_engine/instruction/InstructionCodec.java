package com.flagship.transaction_engine.instruction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Converts instructions to and from their JSON wire payload.
 */
@Component
@RequiredArgsConstructor
public class InstructionCodec {

    private final ObjectMapper objectMapper;

    public String encode(Instruction instruction) {
        try {
            return objectMapper.writeValueAsString(InstructionPayload.from(instruction));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize instruction", e);
        }
    }

    /**
     * Decodes a wire payload.
     *
     * @throws MalformedInstructionException if the payload is not valid JSON or does not
     *                                       describe a valid instruction
     */
    public Instruction decode(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new MalformedInstructionException("Empty instruction payload", null);
        }
        InstructionPayload wire;
        try {
            wire = objectMapper.readValue(payload, InstructionPayload.class);
        } catch (JsonProcessingException e) {
            throw new MalformedInstructionException("Unparseable instruction payload: " + e.getOriginalMessage(), e);
        }
        if (wire == null) {
            throw new MalformedInstructionException("Empty instruction payload", null);
        }
        try {
            return wire.toInstruction();
        } catch (RuntimeException e) {
            throw new MalformedInstructionException("Invalid instruction payload: " + e.getMessage(), e);
        }
    }
}

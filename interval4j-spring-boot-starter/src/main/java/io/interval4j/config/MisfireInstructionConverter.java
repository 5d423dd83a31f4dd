package io.interval4j.config;

import io.interval4j.core.MisfireInstruction;
import org.springframework.core.convert.converter.Converter;

/**
 * Binds {@code interval4j.default-misfire-instruction} through {@link MisfireInstruction#parse(String)},
 * so Quartz constant names such as {@code MISFIRE_INSTRUCTION_DO_NOTHING} are accepted as well.
 */
public class MisfireInstructionConverter implements Converter<String, MisfireInstruction> {

    @Override
    public MisfireInstruction convert(String source) {
        return MisfireInstruction.parse(source);
    }
}

package com.gt.flashcards.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.gt.flashcards.model.SuspensionSource;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class SuspensionSourceSerializer extends JsonSerializer<SuspensionSource> {
    @Override
    public void serialize(SuspensionSource suspensionSource, JsonGenerator jsonGenerator, SerializerProvider serializerProvider) throws IOException {
        jsonGenerator.writeString(suspensionSource.getDbValue());
    }
}

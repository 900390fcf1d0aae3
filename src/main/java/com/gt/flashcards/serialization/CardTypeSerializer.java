package com.gt.flashcards.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.gt.flashcards.model.CardType;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class CardTypeSerializer extends JsonSerializer<CardType> {
    @Override
    public void serialize(CardType cardType, JsonGenerator jsonGenerator, SerializerProvider serializerProvider) throws IOException {
        jsonGenerator.writeString(cardType.getDbValue());
    }
}

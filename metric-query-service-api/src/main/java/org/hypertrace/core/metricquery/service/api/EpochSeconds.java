package org.hypertrace.core.metricquery.service.api;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import java.io.IOException;
import java.time.Instant;

/** CloudWatch JSON carries timestamps as (fractional) epoch seconds. */
final class EpochSeconds {

  private EpochSeconds() {}

  static Instant toInstant(double epochSeconds) {
    return Instant.ofEpochMilli((long) (epochSeconds * 1000L));
  }

  static double fromInstant(Instant instant) {
    return instant.toEpochMilli() / 1000.0;
  }

  static class Deserializer extends JsonDeserializer<Instant> {
    @Override
    public Instant deserialize(JsonParser parser, DeserializationContext context)
        throws IOException {
      if (parser.currentToken() == JsonToken.VALUE_STRING) {
        return Instant.parse(parser.getText());
      }
      return toInstant(parser.getDoubleValue());
    }
  }

  static class Serializer extends JsonSerializer<Instant> {
    @Override
    public void serialize(Instant instant, JsonGenerator generator, SerializerProvider provider)
        throws IOException {
      long millis = instant.toEpochMilli();
      if (millis % 1000L == 0) {
        generator.writeNumber(millis / 1000L);
      } else {
        generator.writeNumber(fromInstant(instant));
      }
    }
  }
}

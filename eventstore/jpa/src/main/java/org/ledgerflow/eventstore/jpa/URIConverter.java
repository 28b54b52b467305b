package org.ledgerflow.eventstore.jpa;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import java.net.URI;

@Converter
public class URIConverter implements AttributeConverter<URI, String> {

  @Override
  public String convertToDatabaseColumn(URI uri) {
    if (uri == null) {
      return null;
    }
    return uri.toString();
  }

  @Override
  public URI convertToEntityAttribute(String uri) {
    if (uri == null) {
      return null;
    }
    return URI.create(uri);
  }
}

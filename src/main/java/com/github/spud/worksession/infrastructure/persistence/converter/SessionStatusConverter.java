package com.github.spud.worksession.infrastructure.persistence.converter;

import com.github.spud.worksession.domain.session.SessionStatus;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link SessionStatus} as its lowercase column value
 */
@Converter
public class SessionStatusConverter implements AttributeConverter<SessionStatus, String> {

  @Override
  public String convertToDatabaseColumn(SessionStatus attribute) {
    return attribute == null ? null : attribute.dbValue();
  }

  @Override
  public SessionStatus convertToEntityAttribute(String dbData) {
    return dbData == null ? null : SessionStatus.fromDbValue(dbData);
  }
}

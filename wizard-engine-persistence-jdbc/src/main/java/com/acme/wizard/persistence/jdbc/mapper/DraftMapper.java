package com.acme.wizard.persistence.jdbc.mapper;

import com.acme.wizard.core.Jsons;
import com.acme.wizard.draft.DraftRecord;
import com.acme.wizard.persistence.jdbc.model.DraftEntity;
import com.fasterxml.jackson.core.type.TypeReference;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps between DraftRecord domain object and DraftEntity persistence model.
 */
public class DraftMapper {

    private static final TypeReference<LinkedHashMap<String, Boolean>> FLAGS_TYPE =
        new TypeReference<>() {};
    private static final TypeReference<LinkedHashMap<String, Map<String, Object>>> STEP_DATA_TYPE =
        new TypeReference<>() {};

    private DraftMapper() {
    }

    public static DraftEntity toEntity(DraftRecord domain) {
        if (domain == null) {
            return null;
        }
        return new DraftEntity(
            domain.id(),
            domain.wizardType(),
            domain.ownerId(),
            domain.referenceNumber(),
            Jsons.toJson(domain.contextSnapshot()),
            domain.currentStepIndex(),
            Jsons.toJson(domain.guardFlags()),
            Jsons.toJson(domain.stepData()),
            domain.createdAt(),
            domain.updatedAt(),
            domain.completed()
        );
    }

    public static DraftRecord toDomain(DraftEntity entity) {
        if (entity == null) {
            return null;
        }
        return new DraftRecord(
            entity.getId(),
            entity.getWizardType(),
            entity.getOwnerId(),
            entity.getReferenceNumber(),
            Jsons.toMap(entity.getContextSnapshot()),
            entity.getCurrentStepIndex(),
            parse(entity.getGuardFlags(), FLAGS_TYPE),
            parse(entity.getStepData(), STEP_DATA_TYPE),
            entity.getCreatedAt(),
            entity.getUpdatedAt(),
            entity.isCompleted()
        );
    }

    private static <T extends Map<?, ?>> T parse(String json, TypeReference<T> type) {
        if (json == null || json.isBlank()) {
            return null;
        }
        return Jsons.fromJson(json, type);
    }
}

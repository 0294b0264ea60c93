package com.example.synthesiseval.interfaces.api.dto;

import com.example.synthesiseval.domain.model.ExtractionRecord;
import com.example.synthesiseval.domain.model.FieldDeclaration;
import com.example.synthesiseval.domain.model.SequenceRecord;

import java.util.List;

/**
 * API-layer DTO for {@code POST /api/evaluations}.
 *
 * @param registry       bundled registry name; ignored when {@code fields} is present
 * @param fields         inline field declarations
 * @param predicted      predicted records
 * @param gold           gold records
 * @param predictedSteps optional predicted step sequences
 * @param goldSteps      optional gold step sequences
 * @param debug          mismatch explanations toggle; {@code null} uses the configured default
 */
public record EvaluationRequestPayload(
        String registry,
        List<FieldDeclaration> fields,
        List<ExtractionRecord> predicted,
        List<ExtractionRecord> gold,
        List<SequenceRecord> predictedSteps,
        List<SequenceRecord> goldSteps,
        Boolean debug
) {
}

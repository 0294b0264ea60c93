package com.example.synthesiseval.application.service;

import com.example.synthesiseval.application.exception.UseCaseValidationException;
import com.example.synthesiseval.domain.model.AnchorPartition;
import com.example.synthesiseval.domain.model.ConfusionCounts;
import com.example.synthesiseval.domain.model.EvaluationRequest;
import com.example.synthesiseval.domain.model.EvaluationResult;
import com.example.synthesiseval.domain.model.ExtractionRecord;
import com.example.synthesiseval.domain.model.FieldMismatch;
import com.example.synthesiseval.domain.model.FieldRegistry;
import com.example.synthesiseval.domain.model.FieldSpec;
import com.example.synthesiseval.domain.model.Metrics;
import com.example.synthesiseval.domain.model.SequenceRecord;
import com.example.synthesiseval.domain.model.SequenceScore;
import com.example.synthesiseval.domain.service.AnchorIndex;
import com.example.synthesiseval.domain.service.AnchorMatcher;
import com.example.synthesiseval.domain.service.ConfusionAccumulator;
import com.example.synthesiseval.domain.service.SequenceAligner;
import com.example.synthesiseval.domain.service.comparator.FieldComparators;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Application-layer service that runs one anchor-keyed evaluation.
 * It indexes both collections by anchor, scores matched anchors field by field, penalises unmatched anchors,
 * scores step sequences and returns an immutable {@link EvaluationResult}.
 */
@Service
public class EvaluationService {

    private static final Logger log = LoggerFactory.getLogger(EvaluationService.class);

	/**
	 * Scores the predicted collection against gold.
	 *
	 * @param request records, registry, optional step sequences and the debug flag
	 * @return per-field and overall metrics, anchor partition, sequence score and debug mismatches
	 * @throws UseCaseValidationException when no field registry is supplied
	 */
    public EvaluationResult evaluate(EvaluationRequest request) {
        if (request == null || request.registry() == null) {
            throw new UseCaseValidationException("A field registry is required to run an evaluation.");
        }
        FieldRegistry registry = request.registry();

        Map<String, ExtractionRecord> predicted = AnchorIndex.byAnchor(
                "predicted", request.predicted(), ExtractionRecord::anchor, ExtractionRecord::hasBlankAnchor);
        Map<String, ExtractionRecord> gold = AnchorIndex.byAnchor(
                "gold", request.gold(), ExtractionRecord::anchor, ExtractionRecord::hasBlankAnchor);
        AnchorPartition anchors = AnchorMatcher.partition(predicted.keySet(), gold.keySet());

        ConfusionAccumulator accumulator = new ConfusionAccumulator(registry.fieldNames());
        List<FieldMismatch> mismatches = new ArrayList<>();

        for (String anchor : anchors.matched()) {
            ExtractionRecord predictedRecord = predicted.get(anchor);
            ExtractionRecord goldRecord = gold.get(anchor);
            for (FieldSpec field : registry.fields()) {
                String predictedRaw = predictedRecord.value(field.name());
                String goldRaw = goldRecord.value(field.name());
                ConfusionCounts counts = FieldComparators.compare(field, predictedRaw, goldRaw);
                accumulator.add(field.name(), counts);
                if (request.debug() && isMismatch(counts, predictedRaw, goldRaw)) {
                    mismatches.add(new FieldMismatch(anchor, field.name(), predictedRaw, goldRaw));
                }
            }
        }
        for (String anchor : anchors.missing()) {
            ExtractionRecord goldRecord = gold.get(anchor);
            for (FieldSpec field : registry.fields()) {
                accumulator.add(field.name(), FieldComparators.unmatchedGold(field, goldRecord.value(field.name())));
            }
        }
        for (String anchor : anchors.extra()) {
            ExtractionRecord predictedRecord = predicted.get(anchor);
            for (FieldSpec field : registry.fields()) {
                accumulator.add(field.name(), FieldComparators.unmatchedPrediction(field, predictedRecord.value(field.name())));
            }
        }

        ConfusionAccumulator.Totals totals = accumulator.finish();
        SequenceScore sequence = request.hasSteps()
                ? scoreSequences(request.predictedSteps(), request.goldSteps())
                : SequenceScore.empty();

        logSummary(registry, anchors, totals.overall(), sequence);
        if (log.isDebugEnabled()) {
            mismatches.forEach(mismatch -> log.debug("Mismatch anchor={} field={} predicted='{}' gold='{}'",
                    mismatch.anchor(), mismatch.field(), mismatch.predictedRaw(), mismatch.goldRaw()));
        }

        return new EvaluationResult(
                registry.name(),
                totals.fields(),
                totals.overall(),
                anchors,
                sequence,
                mismatches
        );
    }

	/**
	 * Indexes both step collections by anchor and runs the positional aligner.
	 *
	 * @param predictedSteps predicted sequences
	 * @param goldSteps      gold sequences
	 * @return sequence score over the union of anchors
	 */
    private SequenceScore scoreSequences(List<SequenceRecord> predictedSteps, List<SequenceRecord> goldSteps) {
        Map<String, SequenceRecord> predicted = AnchorIndex.byAnchor(
                "predicted steps", predictedSteps, SequenceRecord::anchor, SequenceRecord::hasBlankAnchor);
        Map<String, SequenceRecord> gold = AnchorIndex.byAnchor(
                "gold steps", goldSteps, SequenceRecord::anchor, SequenceRecord::hasBlankAnchor);
        return SequenceAligner.align(stepsByAnchor(predicted), stepsByAnchor(gold));
    }

    private Map<String, List<String>> stepsByAnchor(Map<String, SequenceRecord> records) {
        Map<String, List<String>> steps = new LinkedHashMap<>();
        records.forEach((anchor, record) -> steps.put(anchor, record.steps()));
        return steps;
    }

	/**
	 * A field is reported when it cost errors, or when the raw values differ but neither side parsed into
	 * anything the comparator could score (e.g. {@code "broad"} against {@code "sharp"} for bands).
	 */
    private boolean isMismatch(ConfusionCounts counts, String predictedRaw, String goldRaw) {
        if (counts.hasErrors()) {
            return true;
        }
        return counts.equals(ConfusionCounts.ZERO) && !predictedRaw.equals(goldRaw);
    }

    private void logSummary(FieldRegistry registry, AnchorPartition anchors, Metrics overall, SequenceScore sequence) {
        ConfusionCounts counts = overall.counts();
        log.info("Evaluated registry={} matched={} missing={} extra={} tp={} fp={} fn={} f1={}",
                registry.name(),
                anchors.matched().size(),
                anchors.missing().size(),
                anchors.extra().size(),
                counts.truePositives(),
                counts.falsePositives(),
                counts.falseNegatives(),
                String.format(Locale.ROOT, "%.3f", overall.f1()));
        if (!sequence.isEmpty()) {
            ConfusionCounts steps = sequence.total().counts();
            log.info("Scored step sequences anchors={} tp={} fp={} fn={}",
                    sequence.perAnchor().size(), steps.truePositives(), steps.falsePositives(), steps.falseNegatives());
        }
    }
}

package dev.resumeranker.service;

import dev.resumeranker.extraction.ContactExtractor;
import dev.resumeranker.extraction.SkillExtractor;
import dev.resumeranker.extraction.SkillExtractor.JobRequirements;
import dev.resumeranker.extraction.SkillExtractor.SkillMatches;
import dev.resumeranker.extraction.TextNormalizer;
import dev.resumeranker.model.ContactInfo;
import dev.resumeranker.model.ExtractionWarning;
import dev.resumeranker.model.FileMetadata;
import dev.resumeranker.model.JobDescriptionRecord;
import dev.resumeranker.model.ResumeRecord;
import dev.resumeranker.model.ResumeSubmission;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Builds {@link ResumeRecord} and {@link JobDescriptionRecord} instances from plain extracted text.
 * Extraction problems never escape: they are recorded as warnings on the record.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResumeIngestionService {

    private static final Pattern LINE_BREAK = Pattern.compile("\\R");

    private final TextNormalizer normalizer;
    private final ContactExtractor contactExtractor;
    private final SkillExtractor skillExtractor;

    public ResumeRecord ingest(ResumeSubmission submission) {
        return ingest(submission.submissionId(), submission.rawText(), submission.metadata());
    }

    /**
     * Normalize a resume and extract its features.
     *
     * @param submissionId id of this upload, or null to derive one from fingerprint and file name
     * @param rawText      plain text of the resume
     * @param metadata     file metadata from the upload
     */
    public ResumeRecord ingest(String submissionId, String rawText, FileMetadata metadata) {
        List<ExtractionWarning> warnings = new ArrayList<>();
        String normalized = normalizer.normalize(rawText);
        String fingerprint = normalizer.fingerprint(normalized);
        if (normalized.isEmpty()) {
            warnings.add(ExtractionWarning.EMPTY_TEXT);
        }

        ContactInfo contact = extractContact(rawText, warnings);
        SkillMatches skills = extractSkills(normalized, warnings);

        String id = submissionId != null && !submissionId.isBlank()
                ? submissionId
                : deriveSubmissionId(fingerprint, metadata);

        ResumeRecord record = ResumeRecord.builder()
                .submissionId(id)
                .fingerprint(fingerprint)
                .rawText(rawText == null ? "" : rawText)
                .normalizedText(normalized)
                .contact(contact)
                .skills(skills.all())
                .partialSkills(skills.partial())
                .warnings(List.copyOf(warnings))
                .metadata(metadata)
                .build();

        if (record.isExtractionDegraded()) {
            log.warn("Extraction degraded for '{}': {}", record.getDisplayName(), warnings);
        } else {
            log.debug("Ingested '{}' with {} skills", record.getDisplayName(), record.getSkills().size());
        }
        return record;
    }

    /**
     * Normalize a job description and extract its requirement terms.
     */
    public JobDescriptionRecord describeJob(String rawText) {
        String normalized = normalizer.normalize(rawText);
        JobRequirements requirements;
        try {
            requirements = skillExtractor.extractRequirements(rawText);
        } catch (RuntimeException e) {
            log.warn("Requirement extraction failed for job description: {}", e.getMessage());
            requirements = new JobRequirements(Set.of(), Set.of(), Set.of());
        }

        JobDescriptionRecord job = JobDescriptionRecord.builder()
                .jobId(normalizer.fingerprint(normalized))
                .title(firstLine(rawText))
                .rawText(rawText == null ? "" : rawText)
                .normalizedText(normalized)
                .requirementTerms(requirements.all())
                .requiredTerms(requirements.required())
                .preferredTerms(requirements.preferred())
                .build();

        log.info("Job description '{}': {} requirement terms ({} required, {} preferred)",
                job.getTitle(), requirements.all().size(), requirements.required().size(),
                requirements.preferred().size());
        return job;
    }

    private ContactInfo extractContact(String rawText, List<ExtractionWarning> warnings) {
        ContactInfo contact;
        try {
            contact = contactExtractor.extract(rawText);
        } catch (RuntimeException e) {
            log.warn("Contact extraction failed: {}", e.getMessage());
            warnings.add(ExtractionWarning.CONTACT_EXTRACTION_FAILED);
            return ContactInfo.EMPTY;
        }
        if (!contact.hasName()) {
            warnings.add(ExtractionWarning.NAME_NOT_FOUND);
        }
        if (!contact.hasEmail()) {
            warnings.add(ExtractionWarning.EMAIL_NOT_FOUND);
        }
        if (!contact.hasPhone()) {
            warnings.add(ExtractionWarning.PHONE_NOT_FOUND);
        }
        return contact;
    }

    private SkillMatches extractSkills(String normalized, List<ExtractionWarning> warnings) {
        SkillMatches skills;
        try {
            skills = skillExtractor.extract(normalized);
        } catch (RuntimeException e) {
            log.warn("Skill extraction failed: {}", e.getMessage());
            warnings.add(ExtractionWarning.SKILL_EXTRACTION_FAILED);
            return SkillMatches.NONE;
        }
        if (skills.isEmpty() && !normalized.isEmpty()) {
            warnings.add(ExtractionWarning.NO_SKILLS_FOUND);
        }
        return new SkillMatches(skills.exact(), new LinkedHashSet<>(skills.partial()));
    }

    private String deriveSubmissionId(String fingerprint, FileMetadata metadata) {
        String fileName = metadata != null && metadata.fileName() != null ? metadata.fileName() : "resume";
        return fingerprint.substring(0, 12) + ":" + fileName;
    }

    private String firstLine(String rawText) {
        if (rawText == null) {
            return "";
        }
        for (String line : LINE_BREAK.split(rawText)) {
            if (!line.isBlank()) {
                return line.strip();
            }
        }
        return "";
    }
}

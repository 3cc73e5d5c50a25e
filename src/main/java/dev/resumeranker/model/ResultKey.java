package dev.resumeranker.model;

/**
 * Identity of a {@link MatchResult}: the resume content fingerprint scoped to a job description.
 */
public record ResultKey(String resumeFingerprint, String jobId) {

    public static ResultKey of(ResumeRecord resume, JobDescriptionRecord job) {
        return new ResultKey(resume.getFingerprint(), job.getJobId());
    }

    @Override
    public String toString() {
        return abbreviate(resumeFingerprint) + "@" + abbreviate(jobId);
    }

    private static String abbreviate(String hash) {
        return hash == null || hash.length() <= 12 ? String.valueOf(hash) : hash.substring(0, 12);
    }
}

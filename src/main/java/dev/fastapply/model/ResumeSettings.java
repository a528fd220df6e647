package dev.fastapply.model;

/**
 * Resume options applied to every job of one flush.
 *
 * @param useTailoredResume generate a tailored resume per application
 * @param resumeType        "pdf" or "docx", null when not tailored
 * @param resumeTemplate    template name, null for the default one
 */
public record ResumeSettings(boolean useTailoredResume, String resumeType, String resumeTemplate) {

    private static final ResumeSettings NONE = new ResumeSettings(false, null, null);

    public static ResumeSettings none() {
        return NONE;
    }

    public static ResumeSettings tailored(String resumeType, String resumeTemplate) {
        return new ResumeSettings(true, resumeType, resumeTemplate);
    }
}

package dev.fastapply.model;

public record JobDetails(String title, String company, String platform) {

    public static JobDetails empty() {
        return new JobDetails(null, null, null);
    }

    public JobDetails withPlatform(String newPlatform) {
        return new JobDetails(title, company, newPlatform);
    }
}

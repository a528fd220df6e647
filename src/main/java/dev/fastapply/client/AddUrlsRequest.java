package dev.fastapply.client;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.fastapply.model.ResumeSettings;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AddUrlsRequest(List<String> jobUrls, List<UrlInput> jobDetails, ResumeSettings resumeSettings) {

    public static AddUrlsRequest of(List<UrlInput> urls, ResumeSettings resumeSettings) {
        return new AddUrlsRequest(urls.stream().map(UrlInput::url).toList(), urls, resumeSettings);
    }
}

package dev.fastapply.client;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record UrlInput(String url, String jobTitle, String company, String platform) {
}

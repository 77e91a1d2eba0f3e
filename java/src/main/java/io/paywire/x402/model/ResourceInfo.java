package io.paywire.x402.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/** Describes the protected resource a challenge or payload refers to. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ResourceInfo {
    public String url;
    public String description;
    public String mimeType;

    /** Default constructor for Jackson. */
    public ResourceInfo() {}

    public ResourceInfo(String url, String description, String mimeType) {
        this.url = url;
        this.description = description;
        this.mimeType = mimeType;
    }
}

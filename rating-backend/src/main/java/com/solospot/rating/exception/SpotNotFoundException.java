package com.solospot.rating.exception;

/**
 * 引用的资源（目前只有地点）不存在。调用方错误，不重试。
 */
public class SpotNotFoundException extends RatingException {

    private final String resource;
    private final String resourceId;

    public SpotNotFoundException(String spotId) {
        this("spot", spotId);
    }

    public SpotNotFoundException(String resource, String resourceId) {
        super(resource + " not found: " + resourceId);
        this.resource = resource;
        this.resourceId = resourceId;
    }

    public String getResource() {
        return resource;
    }

    public String getResourceId() {
        return resourceId;
    }
}

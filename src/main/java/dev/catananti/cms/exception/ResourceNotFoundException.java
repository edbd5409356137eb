package dev.catananti.cms.exception;

import java.util.Map;

public class ResourceNotFoundException extends CmsException {

    public ResourceNotFoundException(String resource, String field, Object value) {
        super(resource + " not found", Map.of("resource", resource, field, String.valueOf(value)));
    }

    public ResourceNotFoundException(String message) {
        super(message);
    }
}

package com.easyinstall.backup.utils;

import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.PathNotFoundException;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads single values out of raw JSON response bodies.
 */
@Slf4j
public class JPathUtils {

    public static Object get(String json, String expression) {
        log.debug("getting for expression -{} ", expression);
        try {
            var value = JsonPath.read(json, expression);
            log.debug("Getting for expression -{} with value {}", expression, value);
            return value;
        } catch (PathNotFoundException e) {
            log.warn("No value for Expression -{}", expression);
            return null;
        }
    }

    public static String getString(String json, String expression) {
        Object value = get(json, expression);
        return value == null ? null : value.toString();
    }
}

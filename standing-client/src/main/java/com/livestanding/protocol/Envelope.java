package com.livestanding.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One frame of the broadcast protocol, as received from the server.
 *
 * JSON format:
 * {
 *     "code": 200,
 *     "data": "{...snapshot...}",
 *     "message": "error detail"
 * }
 *
 * {@code data} is only meaningful for the payload code and {@code message} only
 * for error codes. Instances are read-only once built.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Envelope {

    public static final int MISSING_CODE = -1;

    private Integer code;
    private String data;
    private String message;

    // Default constructor for Jackson deserialization
    public Envelope() {
    }

    private Envelope(Integer code, String data, String message) {
        this.code = code;
        this.data = data;
        this.message = message;
    }

    public Integer getCode() {
        return code;
    }

    public String getData() {
        return data;
    }

    public String getMessage() {
        return message;
    }

    // Setters for Jackson deserialization
    public void setCode(Integer code) {
        this.code = code;
    }

    public void setData(String data) {
        this.data = data;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    /**
     * Returns the status code, or {@link #MISSING_CODE} when the frame had none.
     */
    public int codeOrMissing() {
        return code != null ? code : MISSING_CODE;
    }

    public boolean hasData() {
        return data != null && !data.isEmpty();
    }

    public static Envelope authenticated(int code) {
        return new Envelope(code, null, null);
    }

    public static Envelope payload(int code, String data) {
        return new Envelope(code, data, null);
    }

    public static Envelope error(int code, String message) {
        return new Envelope(code, null, message);
    }

    @Override
    public String toString() {
        return "Envelope{" +
                "code=" + code +
                ", dataLength=" + (data != null ? data.length() : 0) +
                ", message='" + message + '\'' +
                '}';
    }
}

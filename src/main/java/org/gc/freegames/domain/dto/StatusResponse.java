package org.gc.freegames.domain.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.gc.freegames.domain.SubscriptionResult;

import java.util.Map;

/**
 * Reply of the subscription endpoints. Only the fields relevant to the request are set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StatusResponse {

    private String message;
    private String subscriber;
    private String jobId;
    /** Daily delivery time as HH:MM in the reference zone. */
    private String time;
    private Boolean subscribed;
    private SubscriptionResult result;
    private Map<String, Object> details;

    public static StatusResponse of(String message) {
        return StatusResponse.builder()
                .message(message)
                .build();
    }
}

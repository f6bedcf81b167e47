package org.gc.freegames.domain.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.gc.freegames.domain.SubscriberType;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SubscribeRequest {

    @NotNull(message = "Subscriber type is required")
    private SubscriberType type;

    @NotBlank(message = "Subject id is required")
    private String subjectId;

    /**
     * Daily delivery time as HH:MM, e.g. 8:30.
     */
    @NotBlank(message = "Delivery time is required")
    @Pattern(regexp = "^\\d{1,2}:\\d{1,2}$", message = "Delivery time must use the HH:MM format")
    private String time;
}

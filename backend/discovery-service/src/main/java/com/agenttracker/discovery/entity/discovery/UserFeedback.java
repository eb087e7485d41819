package com.agenttracker.discovery.entity.discovery;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * User's verdict on a discovery. {@code useful == null} means no verdict yet.
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserFeedback {

    @Column(name = "feedback_useful")
    private Boolean useful;

    @Column(name = "feedback_notes", length = 2048)
    private String notes;

    /**
     * Optional 1-5 rating
     */
    @Column(name = "feedback_relevance")
    private Integer relevance;

    @JsonIgnore
    public boolean isSet() {
        return useful != null;
    }
}

package com.fabric.runtime.contract;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.Objects;

/**
 * Any subset of user, session and solution. On a contract, an absent dimension matches every
 * requester; a present one must equal the requester's.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MaterializationScope {

    private String userId;
    private String sessionId;
    private String solutionId;

    public static MaterializationScope any() {
        return new MaterializationScope();
    }

    public boolean admits(MaterializationScope requester) {
        MaterializationScope other = requester != null ? requester : any();
        return matches(userId, other.userId)
                && matches(sessionId, other.sessionId)
                && matches(solutionId, other.solutionId);
    }

    @JsonIgnore
    public boolean isUnrestricted() {
        return userId == null && sessionId == null && solutionId == null;
    }

    private static boolean matches(String required, String offered) {
        return required == null || Objects.equals(required, offered);
    }
}

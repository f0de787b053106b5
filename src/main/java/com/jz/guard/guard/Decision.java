package com.jz.guard.guard;


import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.jz.guard.domain.vo.SessionSnapshotVO;
import lombok.*;

import java.util.List;

@Data @Builder @NoArgsConstructor @AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Decision {

    static final String MSG_BLOCKED = "Your access has been temporarily restricted: ";
    static final String MSG_FLAGGED =
            "Your message contains inappropriate content. Please keep conversations respectful and on-topic.";
    static final String MSG_INTERNAL = "Moderation is temporarily unavailable, please try again later.";

    private boolean allowed;
    private DecisionReason reason;
    private String message;          // 给用户看的说明，拒绝时总是有值

    @JsonProperty("retry_after")
    private Long retryAfter;         // 秒，仅限流时有值

    private List<String> flags;      // 只含标签类别，不含具体命中的词/正则

    @JsonProperty("session_info")
    private SessionSnapshotVO sessionInfo;

    public static Decision approved(SessionSnapshotVO session) {
        return Decision.builder().allowed(true).reason(DecisionReason.APPROVED)
                .message("Message approved").sessionInfo(session).build();
    }
    public static Decision userBlocked(String blockReason) {
        return Decision.builder().allowed(false).reason(DecisionReason.USER_BLOCKED)
                .message(MSG_BLOCKED + blockReason).build();
    }
    public static Decision rateLimited(String detail, long retryAfterSeconds) {
        return Decision.builder().allowed(false).reason(DecisionReason.RATE_LIMITED)
                .message(detail).retryAfter(retryAfterSeconds).build();
    }
    public static Decision contentFlagged(List<String> publicTags) {
        return Decision.builder().allowed(false).reason(DecisionReason.CONTENT_FLAGGED)
                .message(MSG_FLAGGED).flags(publicTags).build();
    }
    public static Decision invalidInput(String why) {
        return Decision.builder().allowed(false).reason(DecisionReason.INVALID_INPUT).message(why).build();
    }
    public static Decision internalError() {
        return Decision.builder().allowed(false).reason(DecisionReason.INTERNAL_ERROR).message(MSG_INTERNAL).build();
    }
}

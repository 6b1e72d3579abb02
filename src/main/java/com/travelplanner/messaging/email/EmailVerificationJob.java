package com.travelplanner.messaging.email;

import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@Getter
@Setter
@ToString(callSuper = true)
@NoArgsConstructor
public class EmailVerificationJob extends EmailJob {

    @ToString.Exclude
    @NotBlank(message = "Verification token is required")
    private String token;

    private String fullName;

    public EmailVerificationJob(String to, String token, String fullName) {
        super(to);
        this.token = token;
        this.fullName = fullName;
    }

    @Override
    public EmailJobType getType() {
        return EmailJobType.EMAIL_VERIFICATION;
    }
}

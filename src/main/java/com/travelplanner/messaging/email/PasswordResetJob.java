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
public class PasswordResetJob extends EmailJob {

    @ToString.Exclude
    @NotBlank(message = "Password reset token is required")
    private String token;

    public PasswordResetJob(String to, String token) {
        super(to);
        this.token = token;
    }

    @Override
    public EmailJobType getType() {
        return EmailJobType.PASSWORD_RESET;
    }
}

package com.travelplanner.messaging.email;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@Getter
@Setter
@ToString(callSuper = true)
@NoArgsConstructor
public class WelcomeEmailJob extends EmailJob {

    private String fullName;

    public WelcomeEmailJob(String to, String fullName) {
        super(to);
        this.fullName = fullName;
    }

    @Override
    public EmailJobType getType() {
        return EmailJobType.WELCOME_EMAIL;
    }
}

package com.travelplanner.messaging.email;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.travelplanner.messaging.RetryableJob;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Body of a message on {@code email_job_queue}.
 *
 * <p>Wire format is a JSON object discriminated by {@code type}:
 * <pre>
 * {"type":"welcome_email","to":"a@b.com","fullName":"Ada","retryCount":1}
 * </pre>
 * An unknown or missing {@code type} fails decoding.
 */
@Getter
@Setter
@ToString
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = EmailVerificationJob.class, name = EmailJobType.EMAIL_VERIFICATION_NAME),
        @JsonSubTypes.Type(value = WelcomeEmailJob.class, name = EmailJobType.WELCOME_EMAIL_NAME),
        @JsonSubTypes.Type(value = PasswordResetJob.class, name = EmailJobType.PASSWORD_RESET_NAME)
})
public abstract class EmailJob implements RetryableJob {

    @NotBlank(message = "must not be blank")
    @Email(message = "must be a valid e-mail address")
    private String to;

    @Min(value = 0, message = "must be >= 0")
    private Integer retryCount;

    protected EmailJob(String to) {
        this.to = to;
    }

    @JsonIgnore
    public abstract EmailJobType getType();

    /**
     * Retries are capped per email type.
     */
    @Override
    public String retryKey() {
        return getType().getWireName();
    }
}

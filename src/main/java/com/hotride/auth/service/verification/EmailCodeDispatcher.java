package com.hotride.auth.service.verification;

import com.hotride.auth.config.AuthProperties;
import com.hotride.auth.exception.CodeDispatchException;
import com.hotride.auth.model.CodeChannel;
import com.hotride.auth.model.CodePurpose;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class EmailCodeDispatcher implements CodeDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(EmailCodeDispatcher.class);

    private final JavaMailSender mailSender;
    private final AuthProperties properties;

    public EmailCodeDispatcher(JavaMailSender mailSender, AuthProperties properties) {
        this.mailSender = mailSender;
        this.properties = properties;
    }

    @Override
    public CodeChannel channel() {
        return CodeChannel.EMAIL;
    }

    @Override
    public void dispatch(String target, String code, CodePurpose purpose, Duration validity) {
        try {
            MimeMessage message = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, "UTF-8");
            helper.setFrom(properties.getMailFrom());
            helper.setTo(target);
            helper.setSubject(purpose == CodePurpose.PASSWORD_RESET
                    ? "Reset your HotRide password"
                    : "Verify your HotRide email");
            helper.setText(CodeDispatcher.messageFor(code, purpose, validity));
            mailSender.send(message);
            logger.info("Sent {} code email to account address", purpose);
        } catch (MessagingException | MailException e) {
            logger.error("Failed to send {} code email: {}", purpose, e.getMessage(), e);
            throw new CodeDispatchException("Failed to send verification email", e);
        }
    }
}

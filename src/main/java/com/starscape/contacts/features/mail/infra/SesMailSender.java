package com.starscape.contacts.features.mail.infra;

import com.starscape.contacts.features.mail.app.MailDeliveryException;
import com.starscape.contacts.features.mail.app.MailSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.ses.SesClient;
import software.amazon.awssdk.services.ses.model.Body;
import software.amazon.awssdk.services.ses.model.Content;
import software.amazon.awssdk.services.ses.model.Destination;
import software.amazon.awssdk.services.ses.model.Message;
import software.amazon.awssdk.services.ses.model.SendEmailRequest;
import software.amazon.awssdk.services.ses.model.SendEmailResponse;
import software.amazon.awssdk.services.ses.model.SesException;

import java.nio.charset.StandardCharsets;

/**
 * Sends mail through Amazon SES.
 */
@Component
public class SesMailSender implements MailSender {

    private static final Logger log = LoggerFactory.getLogger(SesMailSender.class);

    private final SesClient sesClient;
    private final String source;

    public SesMailSender(
            SesClient sesClient,
            @Value("${app.mail.from}") String from,
            @Value("${app.mail.from-name:}") String fromName) {
        this.sesClient = sesClient;
        this.source = fromName == null || fromName.isBlank() ? from : fromName + " <" + from + ">";
    }

    @Override
    public void send(String to, String subject, String html) {
        String charset = StandardCharsets.UTF_8.name();
        SendEmailRequest request = SendEmailRequest.builder()
                .source(source)
                .destination(Destination.builder().toAddresses(to).build())
                .message(Message.builder()
                        .subject(Content.builder().charset(charset).data(subject).build())
                        .body(Body.builder()
                                .html(Content.builder().charset(charset).data(html).build())
                                .build())
                        .build())
                .build();

        try {
            SendEmailResponse response = sesClient.sendEmail(request);
            log.debug("SES accepted message {}", response.messageId());
        } catch (SesException e) {
            throw new MailDeliveryException("SES rejected message: " + e.getMessage(), e);
        }
    }
}

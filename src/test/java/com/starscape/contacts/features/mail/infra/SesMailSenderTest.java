package com.starscape.contacts.features.mail.infra;

import com.starscape.contacts.features.mail.app.MailDeliveryException;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.services.ses.SesClient;
import software.amazon.awssdk.services.ses.model.SendEmailRequest;
import software.amazon.awssdk.services.ses.model.SendEmailResponse;
import software.amazon.awssdk.services.ses.model.SesException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class SesMailSenderTest {
    
    private final SesClient sesClient = mock(SesClient.class);
    
    @Test
    void sendsHtmlMessageFromConfiguredSender() {
        when(sesClient.sendEmail(any(SendEmailRequest.class)))
            .thenReturn(SendEmailResponse.builder().messageId("m-1").build());
        SesMailSender sender = new SesMailSender(sesClient, "no-reply@example.com", "Contacts API");
        
        sender.send("to@example.com", "Hello", "<p>Hi</p>");
        
        ArgumentCaptor<SendEmailRequest> captor = ArgumentCaptor.forClass(SendEmailRequest.class);
        verify(sesClient).sendEmail(captor.capture());
        SendEmailRequest request = captor.getValue();
        assertEquals("Contacts API <no-reply@example.com>", request.source());
        assertEquals(List.of("to@example.com"), request.destination().toAddresses());
        assertEquals("Hello", request.message().subject().data());
        assertEquals("<p>Hi</p>", request.message().body().html().data());
    }
    
    @Test
    void usesBareAddressWithoutDisplayName() {
        when(sesClient.sendEmail(any(SendEmailRequest.class)))
            .thenReturn(SendEmailResponse.builder().messageId("m-2").build());
        SesMailSender sender = new SesMailSender(sesClient, "no-reply@example.com", "");
        
        sender.send("to@example.com", "Hello", "<p>Hi</p>");
        
        ArgumentCaptor<SendEmailRequest> captor = ArgumentCaptor.forClass(SendEmailRequest.class);
        verify(sesClient).sendEmail(captor.capture());
        assertEquals("no-reply@example.com", captor.getValue().source());
    }
    
    @Test
    void wrapsProviderRejection() {
        when(sesClient.sendEmail(any(SendEmailRequest.class)))
            .thenThrow(SesException.builder().message("Email address is not verified").statusCode(400).build());
        SesMailSender sender = new SesMailSender(sesClient, "no-reply@example.com", "Contacts API");
        
        assertThrows(MailDeliveryException.class, () -> sender.send("to@example.com", "Hello", "<p>Hi</p>"));
    }
}

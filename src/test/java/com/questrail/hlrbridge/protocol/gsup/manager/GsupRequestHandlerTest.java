package com.questrail.hlrbridge.protocol.gsup.manager;

import com.questrail.hlrbridge.auth.AuthVectorProvider;
import com.questrail.hlrbridge.auth.CryptoException;
import com.questrail.hlrbridge.auth.SubscriberNotFoundException;
import com.questrail.hlrbridge.protocol.gsup.model.AuthVector;
import com.questrail.hlrbridge.protocol.gsup.model.ErrorCause;
import com.questrail.hlrbridge.protocol.gsup.model.GsupMessage;
import com.questrail.hlrbridge.protocol.gsup.model.GsupMessageType;
import com.questrail.hlrbridge.protocol.gsup.model.PdpInfo;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * GsupRequestHandlerTest
 * -----------------------------------------------------------------------------
 * Request-to-response mapping, independent of framing and codec.
 */
final class GsupRequestHandlerTest
{
    private static final String IMSI = "901550000000001";
    private static final AuthVector VECTOR = new AuthVector(new byte[16], new byte[4], new byte[8]);

    @Test
    void sendAuthInfoSuccess()
    {
        GsupRequestHandler handler = new GsupRequestHandler(imsi -> VECTOR);

        GsupMessage response = handler.apply(request(GsupMessageType.SEND_AUTH_INFO_REQUEST)).orElseThrow();

        assertEquals(GsupMessageType.SEND_AUTH_INFO_RESPONSE, response.type());
        assertEquals(IMSI, response.imsi());
        assertEquals(VECTOR, response.authVector().orElseThrow());
    }

    @Test
    void sendAuthInfoUnknownSubscriber()
    {
        AuthVectorProvider provider = imsi -> {
            throw new SubscriberNotFoundException(imsi);
        };
        GsupMessage response = new GsupRequestHandler(provider)
                .apply(request(GsupMessageType.SEND_AUTH_INFO_REQUEST)).orElseThrow();

        assertEquals(GsupMessageType.SEND_AUTH_INFO_ERROR, response.type());
        assertEquals(IMSI, response.imsi());
        assertEquals(ErrorCause.IMSI_UNKNOWN.code(), response.cause().orElseThrow());
    }

    @Test
    void sendAuthInfoCryptoFailure()
    {
        AuthVectorProvider provider = imsi -> {
            throw new CryptoException("no key");
        };
        GsupMessage response = new GsupRequestHandler(provider)
                .apply(request(GsupMessageType.SEND_AUTH_INFO_REQUEST)).orElseThrow();

        assertEquals(GsupMessageType.SEND_AUTH_INFO_ERROR, response.type());
        assertEquals(ErrorCause.NETWORK_FAILURE.code(), response.cause().orElseThrow());
    }

    @Test
    void updateLocationTriggersInsertSubscriberData()
    {
        GsupRequestHandler handler = new GsupRequestHandler(imsi -> VECTOR);

        GsupMessage response = handler.apply(request(GsupMessageType.UPDATE_LOCATION_REQUEST)).orElseThrow();

        assertEquals(GsupMessageType.INSERT_SUBSCRIBER_DATA_REQUEST, response.type());
        assertEquals(IMSI, response.imsi());
        assertEquals(GsupMessage.builder(GsupMessageType.INSERT_SUBSCRIBER_DATA_REQUEST)
                .imsi(IMSI)
                .pdpInfoComplete(new byte[0])
                .pdpInfo(PdpInfo.wildcardApn())
                .build(), response);
    }

    @Test
    void insertSubscriberDataResultCompletesUpdateLocation()
    {
        GsupRequestHandler handler = new GsupRequestHandler(imsi -> VECTOR);

        GsupMessage response = handler.apply(request(GsupMessageType.INSERT_SUBSCRIBER_DATA_RESULT)).orElseThrow();

        assertEquals(GsupMessage.builder(GsupMessageType.UPDATE_LOCATION_RESULT).imsi(IMSI).build(), response);
    }

    @Test
    void reportsAndErrorsProduceNoResponse()
    {
        GsupRequestHandler handler = new GsupRequestHandler(imsi -> fail("provider must not be called"));

        assertEquals(Optional.empty(), handler.apply(request(GsupMessageType.AUTH_FAILURE_REPORT)));
        assertEquals(Optional.empty(), handler.apply(GsupMessage.builder(GsupMessageType.INSERT_SUBSCRIBER_DATA_ERROR)
                .imsi(IMSI)
                .cause(ErrorCause.IMSI_UNKNOWN)
                .build()));
    }

    @Test
    void unexpectedTypesProduceNoResponse()
    {
        GsupRequestHandler handler = new GsupRequestHandler(imsi -> fail("provider must not be called"));

        for (GsupMessageType type : new GsupMessageType[] {
                GsupMessageType.UPDATE_LOCATION_RESULT,
                GsupMessageType.UPDATE_LOCATION_ERROR,
                GsupMessageType.SEND_AUTH_INFO_RESPONSE,
                GsupMessageType.SEND_AUTH_INFO_ERROR,
                GsupMessageType.INSERT_SUBSCRIBER_DATA_REQUEST }) {
            assertTrue(handler.apply(request(type)).isEmpty(), type.toString());
        }
    }

    private static GsupMessage request(GsupMessageType type)
    {
        return GsupMessage.builder(type).imsi(IMSI).build();
    }
}

package com.questrail.hlrbridge.protocol.gsup.manager;

import com.questrail.hlrbridge.auth.AuthVectorProvider;
import com.questrail.hlrbridge.auth.CryptoException;
import com.questrail.hlrbridge.auth.SubscriberNotFoundException;
import com.questrail.hlrbridge.protocol.gsup.model.AuthVector;
import com.questrail.hlrbridge.protocol.gsup.model.ErrorCause;
import com.questrail.hlrbridge.protocol.gsup.model.GsupMessage;
import com.questrail.hlrbridge.protocol.gsup.model.GsupMessageType;
import com.questrail.hlrbridge.protocol.gsup.model.PdpInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * GsupRequestHandler
 * =============================================================================
 * Maps one inbound GSUP message to at most one outbound message.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>SendAuthInfoRequest: ask the provider. Success gives
 *       SendAuthInfoResponse with the triplet; an unknown subscriber gives
 *       SendAuthInfoError(ImsiUnknown); a crypto failure gives
 *       SendAuthInfoError(NetworkFailure).</li>
 *   <li>UpdateLocationRequest: answer with InsertSubscriberDataRequest
 *       announcing the wildcard APN. The location update completes when the
 *       peer confirms.</li>
 *   <li>InsertSubscriberDataResult: answer with UpdateLocationResult.</li>
 *   <li>AuthFailureReport, InsertSubscriberDataError: log only.</li>
 *   <li>Anything else is unexpected from the peer and is logged.</li>
 * </ul>
 *
 * <h2>Statelessness</h2>
 * No state is kept between messages. The Update-Location exchange is carried
 * entirely by the peer echoing the IMSI; if the connection drops mid-exchange
 * nothing needs cleaning up.
 */
public final class GsupRequestHandler
{
    private static final Logger log = LoggerFactory.getLogger(GsupRequestHandler.class);

    private final AuthVectorProvider provider;

    public GsupRequestHandler(AuthVectorProvider provider)
    {
        this.provider = Objects.requireNonNull(provider, "provider");
    }

    public Optional<GsupMessage> apply(GsupMessage request)
    {
        Objects.requireNonNull(request, "request");

        return switch (request.type()) {
            case SEND_AUTH_INFO_REQUEST -> Optional.of(sendAuthInfo(request.imsi()));
            case UPDATE_LOCATION_REQUEST -> Optional.of(GsupMessage.builder(GsupMessageType.INSERT_SUBSCRIBER_DATA_REQUEST)
                    .imsi(request.imsi())
                    .pdpInfoComplete(new byte[0])
                    .pdpInfo(PdpInfo.wildcardApn())
                    .build());
            case INSERT_SUBSCRIBER_DATA_RESULT -> Optional.of(GsupMessage.builder(GsupMessageType.UPDATE_LOCATION_RESULT)
                    .imsi(request.imsi())
                    .build());
            case AUTH_FAILURE_REPORT -> {
                log.info("Authentication failure reported for {}", request.imsi());
                yield Optional.empty();
            }
            case INSERT_SUBSCRIBER_DATA_ERROR -> {
                log.warn("Insert subscriber data rejected for {} (cause {})",
                        request.imsi(), request.cause().orElse(-1));
                yield Optional.empty();
            }
            case UPDATE_LOCATION_ERROR,
                 UPDATE_LOCATION_RESULT,
                 SEND_AUTH_INFO_ERROR,
                 SEND_AUTH_INFO_RESPONSE,
                 INSERT_SUBSCRIBER_DATA_REQUEST -> {
                log.warn("Unexpected {} from peer: {}", request.type(), request);
                yield Optional.empty();
            }
        };
    }

    private GsupMessage sendAuthInfo(String imsi)
    {
        try {
            AuthVector vector = provider.getAuthVector(imsi);
            return GsupMessage.builder(GsupMessageType.SEND_AUTH_INFO_RESPONSE)
                    .imsi(imsi)
                    .authVector(vector)
                    .build();
        }
        catch (SubscriberNotFoundException e) {
            log.info("Auth info requested for unknown subscriber {}", imsi);
            return authInfoError(imsi, ErrorCause.IMSI_UNKNOWN);
        }
        catch (CryptoException e) {
            log.warn("No auth vector for {}: {}", imsi, e.getMessage());
            return authInfoError(imsi, ErrorCause.NETWORK_FAILURE);
        }
    }

    private static GsupMessage authInfoError(String imsi, ErrorCause cause)
    {
        return GsupMessage.builder(GsupMessageType.SEND_AUTH_INFO_ERROR)
                .imsi(imsi)
                .cause(cause)
                .build();
    }
}

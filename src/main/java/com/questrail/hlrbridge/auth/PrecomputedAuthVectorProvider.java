package com.questrail.hlrbridge.auth;

import com.questrail.hlrbridge.protocol.gsup.model.AuthVector;
import com.questrail.hlrbridge.subscriber.AuthAlgorithm;
import com.questrail.hlrbridge.subscriber.GsmServiceState;
import com.questrail.hlrbridge.subscriber.GsmSubscription;
import com.questrail.hlrbridge.subscriber.SubscriberRecord;
import com.questrail.hlrbridge.subscriber.SubscriberStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;

/**
 * PrecomputedAuthVectorProvider
 * -----------------------------------------------------------------------------
 * {@link AuthVectorProvider} that serves triplets stored with the subscriber.
 *
 * <p>Decision order:</p>
 * <ol>
 *   <li>IMSI not in the store: {@link SubscriberNotFoundException}</li>
 *   <li>GSM service not {@link GsmServiceState#ACTIVE}: {@link CryptoException}</li>
 *   <li>Algorithm other than {@link AuthAlgorithm#PRECOMPUTED_AUTH_TUPLES}:
 *       {@link CryptoException}</li>
 *   <li>No stored triplet: {@link CryptoException}</li>
 *   <li>Otherwise the first stored triplet, split RAND/SRES/Kc</li>
 * </ol>
 *
 * <p>The same triplet is returned on every call; rotation is left to whatever
 * provisions the store.</p>
 */
public final class PrecomputedAuthVectorProvider implements AuthVectorProvider
{
    private static final Logger log = LoggerFactory.getLogger(PrecomputedAuthVectorProvider.class);

    private final SubscriberStore store;

    public PrecomputedAuthVectorProvider(SubscriberStore store)
    {
        this.store = Objects.requireNonNull(store, "store");
    }

    @Override
    public AuthVector getAuthVector(String imsi) throws CryptoException, SubscriberNotFoundException
    {
        SubscriberRecord subscriber = store.get(imsi)
                .orElseThrow(() -> new SubscriberNotFoundException(imsi));

        GsmSubscription gsm = subscriber.gsm();
        if (gsm.state() != GsmServiceState.ACTIVE) {
            throw new CryptoException("GSM service not active for " + imsi);
        }
        if (gsm.algorithm() != AuthAlgorithm.PRECOMPUTED_AUTH_TUPLES) {
            throw new CryptoException("Unsupported auth algorithm " + gsm.algorithm() + " for " + imsi);
        }
        if (gsm.authTuples().isEmpty()) {
            throw new CryptoException("No stored auth tuples for " + imsi);
        }

        byte[] tuple = gsm.authTuples().get(0);
        log.debug("Serving stored auth tuple for {}", imsi);

        int sresStart = AuthVector.RAND_LENGTH;
        int kcStart = sresStart + AuthVector.SRES_LENGTH;
        return new AuthVector(
                Arrays.copyOfRange(tuple, 0, sresStart),
                Arrays.copyOfRange(tuple, sresStart, kcStart),
                Arrays.copyOfRange(tuple, kcStart, kcStart + AuthVector.KC_LENGTH));
    }
}

package com.g2e.brokerage.broker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.g2e.brokerage.broker.adapters.AlpacaAdapter;
import com.g2e.brokerage.broker.adapters.ETradeAdapter;
import com.g2e.brokerage.broker.exception.UnsupportedBrokerException;
import com.g2e.brokerage.config.BrokerageConfig;
import com.g2e.brokerage.domain.broker.BrokerCredential;
import com.g2e.brokerage.domain.broker.BrokerId;
import com.g2e.brokerage.domain.broker.SupportedBroker;
import com.g2e.brokerage.infrastructure.broker.http.VendorHttpClient;
import com.g2e.brokerage.repository.BrokerCredentialRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Factory for creating and caching broker adapters.
 *
 * A user's own credential for the vendor wins; otherwise the application credential
 * configured for that vendor is used. Adapters are stateless with respect to tokens, so
 * one instance is shared per distinct credential.
 */
public final class BrokerAdapterFactory {
    private static final Logger log = LoggerFactory.getLogger(BrokerAdapterFactory.class);

    @FunctionalInterface
    public interface AdapterProvider {
        BrokerAdapter create(BrokerCredential credential);
    }

    private final Map<BrokerId, AdapterProvider> providers;
    private final Map<BrokerId, BrokerCredential> applicationCredentials;
    private final BrokerCredentialRepository credentialRepo;
    private final Map<String, BrokerAdapter> adapterCache = new ConcurrentHashMap<>();

    public BrokerAdapterFactory(Map<BrokerId, AdapterProvider> providers,
                                Map<BrokerId, BrokerCredential> applicationCredentials,
                                BrokerCredentialRepository credentialRepo) {
        this.providers = new EnumMap<>(BrokerId.class);
        this.providers.putAll(providers);
        this.applicationCredentials = new EnumMap<>(BrokerId.class);
        this.applicationCredentials.putAll(applicationCredentials);
        this.credentialRepo = credentialRepo;
    }

    /**
     * Factory wired with the production Alpaca and E*TRADE adapters.
     */
    public static BrokerAdapterFactory standard(BrokerageConfig config, BrokerCredentialRepository credentialRepo,
                                                VendorHttpClient http, ObjectMapper mapper, Clock clock) {
        Map<BrokerId, AdapterProvider> providers = new EnumMap<>(BrokerId.class);
        providers.put(BrokerId.ALPACA, credential -> new AlpacaAdapter(credential, http, mapper, clock));
        providers.put(BrokerId.ETRADE, credential -> new ETradeAdapter(credential, http, mapper, clock));

        Map<BrokerId, BrokerCredential> appCredentials = new EnumMap<>(BrokerId.class);
        appCredentials.put(BrokerId.ALPACA, BrokerCredential.application(
            BrokerId.ALPACA, config.alpacaClientId(), config.alpacaClientSecret(), config.alpacaPaper()));
        appCredentials.put(BrokerId.ETRADE, BrokerCredential.application(
            BrokerId.ETRADE, config.etradeConsumerKey(), config.etradeConsumerSecret(), config.etradeSandbox()));

        return new BrokerAdapterFactory(providers, appCredentials, credentialRepo);
    }

    public boolean isSupported(BrokerId brokerId) {
        return providers.containsKey(brokerId);
    }

    /**
     * Adapter for a user's connection to the broker.
     *
     * @throws UnsupportedBrokerException when no adapter is registered for the broker
     */
    public BrokerAdapter forUser(UUID userId, BrokerId brokerId) {
        return forCredential(brokerId, resolveCredential(userId, brokerId));
    }

    /**
     * Adapter parameterized with the application credential.
     */
    public BrokerAdapter forApplication(BrokerId brokerId) {
        return forCredential(brokerId, applicationCredential(brokerId));
    }

    public Optional<BrokerCredential> userCredential(UUID userId, BrokerId brokerId) {
        return credentialRepo == null ? Optional.empty() : credentialRepo.find(userId, brokerId);
    }

    public List<SupportedBroker> supportedBrokers() {
        List<SupportedBroker> result = new ArrayList<>();
        for (BrokerId brokerId : BrokerId.values()) {
            if (isSupported(brokerId)) {
                BrokerAdapter adapter = forApplication(brokerId);
                result.add(new SupportedBroker(brokerId, adapter.brokerName(), adapter.features()));
            }
        }
        return result;
    }

    private BrokerCredential resolveCredential(UUID userId, BrokerId brokerId) {
        if (!isSupported(brokerId)) {
            throw new UnsupportedBrokerException(brokerId.code());
        }
        return userCredential(userId, brokerId).orElseGet(() -> applicationCredential(brokerId));
    }

    private BrokerCredential applicationCredential(BrokerId brokerId) {
        if (!isSupported(brokerId)) {
            throw new UnsupportedBrokerException(brokerId.code());
        }
        BrokerCredential credential = applicationCredentials.get(brokerId);
        return credential != null ? credential : BrokerCredential.application(brokerId, "", "", true);
    }

    private BrokerAdapter forCredential(BrokerId brokerId, BrokerCredential credential) {
        String key = brokerId.code() + ":" + credential.apiKey() + ":"
            + Objects.hashCode(credential.apiSecret()) + ":" + credential.sandbox();
        return adapterCache.computeIfAbsent(key, k -> {
            log.info("[FACTORY] Creating {} adapter for key={}", brokerId, credential.apiKeyHint());
            return providers.get(brokerId).create(credential);
        });
    }

    public int cachedAdapterCount() {
        return adapterCache.size();
    }
}

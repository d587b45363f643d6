package com.tvl.infrastructure.config;

import com.tvl.domain.model.Address;
import com.tvl.domain.model.Role;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import lombok.Value;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Typed view of the application configuration
 */
@Value
public class LedgerConfig {

    public static final int DEFAULT_PORT = 8080;
    /** 1 billion tokens with 18 decimals */
    public static final BigInteger DEFAULT_MAX_SUPPLY = new BigInteger("1000000000000000000000000000");

    int httpPort;
    Address admin;
    Address vestingEngine;
    List<Address> managers;
    Map<Role, List<Address>> vestingRoles;
    BigInteger maxSupply;

    public static LedgerConfig fromJson(JsonObject config) {
        JsonObject http = config.getJsonObject("http", new JsonObject());
        JsonObject ledger = config.getJsonObject("ledger");
        if (ledger == null) {
            throw new IllegalArgumentException("ledger section is required in application.yml");
        }
        JsonObject token = config.getJsonObject("token", new JsonObject());

        Address admin = requiredAddress(ledger, "admin");
        Address vestingEngine = requiredAddress(ledger, "vestingEngine");
        if (admin.isZero() || vestingEngine.isZero()) {
            throw new IllegalArgumentException("ledger.admin and ledger.vestingEngine must not be the zero address");
        }

        Map<Role, List<Address>> vestingRoles = new EnumMap<>(Role.class);
        JsonObject roles = ledger.getJsonObject("vestingRoles", new JsonObject());
        for (String name : roles.fieldNames()) {
            vestingRoles.put(Role.fromValue(name), addresses(roles.getJsonArray(name)));
        }

        String maxSupply = token.getValue("maxSupply") != null ? token.getValue("maxSupply").toString() : null;

        return new LedgerConfig(
                http.getInteger("port", DEFAULT_PORT),
                admin,
                vestingEngine,
                addresses(ledger.getJsonArray("managers")),
                Collections.unmodifiableMap(vestingRoles),
                maxSupply != null ? new BigInteger(maxSupply) : DEFAULT_MAX_SUPPLY
        );
    }

    private static Address requiredAddress(JsonObject section, String key) {
        String value = section.getString(key);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ledger." + key + " is required in application.yml");
        }
        return Address.of(value);
    }

    private static List<Address> addresses(JsonArray values) {
        if (values == null) {
            return List.of();
        }
        List<Address> result = new ArrayList<>();
        for (int i = 0; i < values.size(); i++) {
            result.add(Address.of(values.getString(i)));
        }
        return List.copyOf(result);
    }
}

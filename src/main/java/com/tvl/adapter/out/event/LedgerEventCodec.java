package com.tvl.adapter.out.event;

import com.tvl.domain.event.LedgerEvent;
import com.tvl.domain.event.LedgerEventType;
import com.tvl.domain.model.Address;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.eventbus.MessageCodec;
import io.vertx.core.json.JsonObject;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

/**
 * Message codec for LedgerEvent to enable event bus transmission
 */
public class LedgerEventCodec implements MessageCodec<LedgerEvent, LedgerEvent> {

    @Override
    public void encodeToWire(Buffer buffer, LedgerEvent event) {
        String encoded = toJson(event).encode();
        byte[] bytes = encoded.getBytes(StandardCharsets.UTF_8);
        buffer.appendInt(bytes.length);
        buffer.appendBytes(bytes);
    }

    @Override
    public LedgerEvent decodeFromWire(int position, Buffer buffer) {
        int length = buffer.getInt(position);
        int offset = position + 4;
        String jsonStr = buffer.getString(offset, offset + length, StandardCharsets.UTF_8.name());
        return fromJson(new JsonObject(jsonStr));
    }

    @Override
    public LedgerEvent transform(LedgerEvent event) {
        // Immutable, safe to hand over as is
        return event;
    }

    @Override
    public String name() {
        return "LedgerEventCodec";
    }

    @Override
    public byte systemCodecID() {
        return -1; // -1 indicates custom codec
    }

    public static JsonObject toJson(LedgerEvent event) {
        JsonObject attributes = new JsonObject();
        event.getAttributes().forEach(attributes::put);
        return new JsonObject()
                .put("type", event.getType().name())
                .put("ledger", event.getLedger())
                .put("referenceId", event.getReferenceId())
                .put("account", event.getAccount() != null ? event.getAccount().value() : null)
                .put("amount", event.getAmount() != null ? event.getAmount().toString() : null)
                .put("occurredAt", event.getOccurredAt())
                .put("attributes", attributes);
    }

    public static LedgerEvent fromJson(JsonObject json) {
        LedgerEvent.LedgerEventBuilder builder = LedgerEvent.builder()
                .type(LedgerEventType.valueOf(json.getString("type")))
                .ledger(json.getString("ledger"))
                .referenceId(json.getLong("referenceId", 0L))
                .occurredAt(json.getLong("occurredAt", 0L));
        String account = json.getString("account");
        if (account != null) {
            builder.account(Address.of(account));
        }
        String amount = json.getString("amount");
        if (amount != null) {
            builder.amount(new BigInteger(amount));
        }
        JsonObject attributes = json.getJsonObject("attributes", new JsonObject());
        for (String name : attributes.fieldNames()) {
            builder.attribute(name, attributes.getString(name));
        }
        return builder.build();
    }
}

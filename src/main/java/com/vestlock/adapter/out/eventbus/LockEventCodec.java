package com.vestlock.adapter.out.eventbus;

import com.vestlock.domain.event.LockEvent;
import com.vestlock.domain.model.AssetRef;
import com.vestlock.domain.model.LockId;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.eventbus.MessageCodec;
import io.vertx.core.json.JsonObject;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

/**
 * Message codec for LockEvent to enable event bus transmission
 */
public class LockEventCodec implements MessageCodec<LockEvent, LockEvent> {

    @Override
    public void encodeToWire(Buffer buffer, LockEvent event) {
        JsonObject json = toJson(event);

        byte[] encoded = json.encode().getBytes(StandardCharsets.UTF_8);
        buffer.appendInt(encoded.length);
        buffer.appendBytes(encoded);
    }

    @Override
    public LockEvent decodeFromWire(int position, Buffer buffer) {
        int length = buffer.getInt(position);
        int offset = position + 4;
        String jsonStr = buffer.getString(offset, offset + length, StandardCharsets.UTF_8.name());

        return fromJson(new JsonObject(jsonStr));
    }

    @Override
    public LockEvent transform(LockEvent event) {
        // Immutable, safe to hand over locally
        return event;
    }

    @Override
    public String name() {
        return "LockEventCodec";
    }

    @Override
    public byte systemCodecID() {
        return -1; // -1 indicates custom codec
    }

    static JsonObject toJson(LockEvent event) {
        return new JsonObject()
                .put("type", event.getType().name())
                .put("lockId", event.getLockId().toHex())
                .put("owner", event.getOwner())
                .put("asset", event.getAsset().key())
                .put("amount", event.getAmount().toString())
                .put("timestamp", event.getTimestamp().getEpochSecond());
    }

    static LockEvent fromJson(JsonObject json) {
        return new LockEvent(
                LockEvent.Type.valueOf(json.getString("type")),
                LockId.parse(json.getString("lockId")),
                json.getString("owner"),
                AssetRef.parse(json.getString("asset")),
                new BigInteger(json.getString("amount")),
                Instant.ofEpochSecond(json.getLong("timestamp"))
        );
    }
}

package com.spotladder.infrastructure.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.spotladder.application.ports.LedgerCorruptException;
import com.spotladder.application.ports.LedgerWriteException;
import com.spotladder.application.ports.OrderLedgerPort;
import com.spotladder.domain.order.OrderRecord;
import com.spotladder.domain.order.OrderSide;
import com.spotladder.domain.order.OrderStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Order ledger stored as one JSON document: {@code {"orders":[...]}}.
 *
 * <p>Saves write a temporary file next to the ledger and move it into place, so a reader sees either the
 * previous or the new content. A missing or blank file is an empty ledger; anything unreadable is
 * {@link LedgerCorruptException} and is never overwritten implicitly.
 */
public final class JsonOrderLedger implements OrderLedgerPort {

    private static final Logger log = LoggerFactory.getLogger(JsonOrderLedger.class);

    static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'").withZone(ZoneOffset.UTC);

    private final Path file;
    private final ObjectMapper om;

    public JsonOrderLedger(Path file) {
        this.file = Objects.requireNonNull(file, "file").toAbsolutePath();
        this.om = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public List<OrderRecord> load() {
        if (!Files.exists(file)) return List.of();

        String raw;
        try {
            raw = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new LedgerCorruptException("Cannot read order ledger " + file, e);
        }
        if (raw.isBlank()) return List.of();

        JsonNode root;
        try {
            root = om.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new LedgerCorruptException("Order ledger " + file + " is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new LedgerCorruptException("Order ledger " + file + " is not a JSON object");
        }
        JsonNode orders = root.get("orders");
        if (orders == null || orders.isNull()) return List.of();
        if (!orders.isArray()) {
            throw new LedgerCorruptException("Order ledger " + file + ": 'orders' is not a list");
        }

        List<OrderRecord> out = new ArrayList<>(orders.size());
        for (int i = 0; i < orders.size(); i++) {
            JsonNode node = orders.get(i);
            try {
                if (!node.isObject()) throw new IllegalArgumentException("entry is not an object");
                out.add(toRecord(om.treeToValue(node, LedgerEntry.class)));
            } catch (JsonProcessingException | RuntimeException e) {
                throw new LedgerCorruptException("Order ledger " + file + ": entry " + i + " is malformed: "
                        + e.getMessage(), e);
            }
        }
        return out;
    }

    @Override
    public void save(List<OrderRecord> records) {
        Objects.requireNonNull(records, "records");
        List<LedgerEntry> entries = new ArrayList<>(records.size());
        for (OrderRecord r : records) entries.add(toEntry(r));

        Path dir = file.getParent();
        Path tmp = null;
        try {
            String json = om.writeValueAsString(new LedgerDocument(entries));
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, file.getFileName().toString() + ".", ".tmp");
            Files.writeString(tmp, json, StandardCharsets.UTF_8);
            copyPermissions(file, tmp);
            try {
                Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Saved {} order(s) to {}", records.size(), file);
        } catch (IOException e) {
            deleteQuietly(tmp, e);
            throw new LedgerWriteException("Cannot write order ledger " + file, e);
        }
    }

    /**
     * Temp files are created owner-only; the replacement keeps whatever mode the ledger already had.
     */
    static void copyPermissions(Path from, Path to) throws IOException {
        if (!Files.exists(from)) return;
        PosixFileAttributeView view = Files.getFileAttributeView(from, PosixFileAttributeView.class);
        if (view == null) return;
        Files.setPosixFilePermissions(to, view.readAttributes().permissions());
    }

    static LedgerEntry toEntry(OrderRecord r) {
        return new LedgerEntry(r.orderId(), r.symbol(), r.side().wireName(),
                r.amount().toPlainString(), r.price().toPlainString(), r.status().name(),
                TIMESTAMP.format(r.createdAt()), r.note(), r.linkedOrderId());
    }

    static OrderRecord toRecord(LedgerEntry e) {
        return new OrderRecord(
                require(e.orderId(), "order_id"),
                require(e.symbol(), "symbol"),
                OrderSide.fromWire(require(e.side(), "side")),
                new BigDecimal(require(e.amount(), "amount").trim()),
                new BigDecimal(require(e.price(), "price").trim()),
                OrderStatus.fromWire(require(e.status(), "status")),
                parseInstant(require(e.createdAt(), "created_at")),
                e.note(),
                e.linkedOrderId());
    }

    private static Instant parseInstant(String value) {
        try {
            return Instant.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("created_at is not an ISO-8601 UTC timestamp: " + value, e);
        }
    }

    private static String require(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("missing " + field);
        }
        return value;
    }

    private static void deleteQuietly(Path tmp, IOException cause) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException suppressed) {
            cause.addSuppressed(suppressed);
        }
    }
}

// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.recordmap;

import io.github.simbo1905.LoggingControl;
import io.github.simbo1905.recordmap.model.*;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class RecordMapperTest {

  static final UUID ORDER_ID = UUID.fromString("6f1c2a52-3d4b-4c55-9a0e-8d2b9f3e1a77");

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  static Order sampleOrder() {
    return new Order(
        ORDER_ID,
        new Customer("Ada", "ada@example.com", null),
        List.of(new OrderItem(1, 2), new OrderItem(2, 1)),
        LocalDate.of(2024, 6, 15),
        OrderStatus.PAID,
        new BigDecimal("42.50"),
        null);
  }

  @Test
  @DisplayName("fromMap(toMap(r)) equals r")
  void roundTrip() {
    final RecordMapper<Order> mapper = RecordMapper.forRecord(Order.class);
    final Order order = sampleOrder();

    final Order copy = mapper.fromMap(mapper.toMap(order));

    assertThat(copy).isEqualTo(order);
    assertThat(copy).isNotSameAs(order);
  }

  @Test
  void toMapProducesPlainValuesInDeclarationOrder() {
    final Map<String, Object> map = RecordMaps.toMap(sampleOrder());

    assertThat(map).containsOnlyKeys("id", "customer", "items", "placed_on", "status", "total", "note");
    assertThat(new ArrayList<>(map.keySet()))
        .containsExactly("id", "customer", "items", "placed_on", "status", "total", "note");
    assertThat(map.get("id")).isEqualTo(ORDER_ID.toString());
    assertThat(map.get("status")).isEqualTo("PAID");
    assertThat(map.get("placed_on")).isEqualTo("2024-06-15");
    assertThat(map.get("note")).isNull();
    assertThat(map.get("customer")).isEqualTo(Map.of("name", "Ada", "customer_email", "ada@example.com"));
    assertThat(map.get("items")).isEqualTo(List.of(
        Map.of("productId", 1, "quantity", 2),
        Map.of("productId", 2, "quantity", 1)));
  }

  @Test
  void defaultFillsAbsentKey() {
    final Product product = RecordMaps.fromMap(Product.class, Map.of("name", "Widget"));

    assertThat(product.stock()).isZero();
    assertThat(product.price()).isEqualByComparingTo("9.99");
    assertThat(product.active()).isTrue();
    assertThat(product.tags()).isEmpty();
  }

  @Test
  void presentKeyWinsOverDefault() {
    final Product product = RecordMaps.fromMap(Product.class,
        Map.of("name", "Widget", "stock", "12", "tags", List.of("a", "b")));

    assertThat(product.stock()).isEqualTo(12);
    assertThat(product.tags()).containsExactly("a", "b");
  }

  @Test
  void renamedFieldUsesOnlyItsExternalKey() {
    final Customer customer = new Customer("Ada", "ada@example.com", null);

    final Map<String, Object> map = RecordMaps.toMap(customer);
    assertThat(map).containsEntry("customer_email", "ada@example.com").doesNotContainKey("customerEmail");

    final Map<String, Object> internalName = Map.of("name", "Ada", "customerEmail", "ada@example.com");
    final MissingFieldException missing = catchThrowableOfType(
        () -> RecordMaps.fromMap(Customer.class, internalName), MissingFieldException.class);
    assertThat(missing.externalKey()).isEqualTo("customer_email");
    assertThat(missing.path()).isEqualTo("customerEmail");
  }

  @Test
  void excludedFieldNeverWritten() {
    final Customer customer = new Customer("Ada", "ada@example.com", "s3cret");

    assertThat(RecordMaps.toMap(customer)).doesNotContainKey("password").doesNotContainValue("s3cret");
  }

  @Test
  void excludedFieldStillReadWhenSupplied() {
    final Customer customer = RecordMaps.fromMap(Customer.class,
        Map.of("name", "Ada", "customer_email", "ada@example.com", "password", "s3cret"));

    assertThat(customer.password()).isEqualTo("s3cret");
  }

  @Test
  void dateRendersWithPatternAndParsesBack() {
    final Map<String, Object> map = RecordMaps.toMap(sampleOrder());
    assertThat(map.get("placed_on")).isEqualTo("2024-06-15");

    final Order copy = RecordMaps.fromMap(Order.class, map);
    assertThat(copy.placedOn()).isEqualTo(LocalDate.of(2024, 6, 15));
  }

  @Test
  void nestedListBuildsRecords() {
    final Map<String, Object> input = Map.of("items", List.of(
        Map.of("productId", 1, "quantity", 2),
        Map.of("productId", 2, "quantity", 1)));

    final Cart cart = RecordMaps.fromMap(Cart.class, input);

    assertThat(cart.items()).extracting(OrderItem::productId).containsExactly(1, 2);
    assertThat(cart.items()).extracting(OrderItem::quantity).containsExactly(2, 1);
    assertThat(RecordMaps.toMap(cart)).isEqualTo(input);
  }

  @Test
  void missingRequiredFieldIsNamed() {
    final MissingFieldException missing = catchThrowableOfType(
        () -> RecordMaps.fromMap(Signup.class, Map.of()), MissingFieldException.class);

    assertThat(missing.path()).isEqualTo("email");
    assertThat(missing.externalKey()).isEqualTo("email");
    assertThat(missing.getMessage()).contains("email");
    assertThat(missing.getSuppressed()).isEmpty();
  }

  @Test
  void unknownKeysIgnoredByDefault() {
    final Signup signup = RecordMaps.fromMap(Signup.class,
        Map.of("email", "ada@example.com", "referrer", "newsletter", "utm", Map.of("a", 1)));

    assertThat(signup).isEqualTo(new Signup("ada@example.com", false));
  }

  @Test
  void strictModeRejectsUnknownKeys() {
    final RecordMapper<OrderItem> strict = RecordMapper.forRecord(OrderItem.class,
        MarshalConfig.defaults().withStrict(true));

    assertThatThrownBy(() -> strict.fromMap(Map.of("productId", 1, "quantity", 2, "colour", "red")))
        .isInstanceOf(UnexpectedKeyException.class)
        .hasMessageContaining("colour");
    assertThat(strict.fromMap(Map.of("productId", 1, "quantity", 2))).isEqualTo(new OrderItem(1, 2));
  }

  @Test
  void violationsAcrossFieldsAreReportedTogether() {
    final Map<String, Object> input = new HashMap<>();
    input.put("id", "not-a-uuid");
    input.put("customer", Map.of("name", "Ada"));
    input.put("items", List.of());
    input.put("placed_on", "15/06/2024");
    input.put("total", "12.00");

    final MarshalException failure = catchThrowableOfType(
        () -> RecordMaps.fromMap(Order.class, input), MarshalException.class);

    assertThat(failure).isInstanceOf(TypeCoercionException.class);
    assertThat(failure.path()).isEqualTo("id");
    assertThat(failure.getSuppressed()).hasSize(2);
    assertThat(failure.getSuppressed()[0]).isInstanceOf(MissingFieldException.class)
        .extracting(t -> ((MarshalException) t).path()).isEqualTo("customer.customerEmail");
    assertThat(failure.getSuppressed()[1]).isInstanceOf(DateFormatException.class)
        .extracting(t -> ((MarshalException) t).path()).isEqualTo("placedOn");
  }

  @Test
  void failFastStopsAtFirstViolation() {
    final RecordMapper<Customer> mapper = RecordMapper.forRecord(Customer.class,
        MarshalConfig.defaults().withFailFast(true));

    final MissingFieldException missing = catchThrowableOfType(() -> mapper.fromMap(Map.of()), MissingFieldException.class);

    assertThat(missing.path()).isEqualTo("name");
    assertThat(missing.getSuppressed()).isEmpty();
  }

  @Test
  void nestedListFailureNamesTheLeaf() {
    final Map<String, Object> input = Map.of("items", List.of(
        Map.of("productId", 1, "quantity", 2),
        Map.of("productId", 2, "quantity", "many")));

    final TypeCoercionException failure = catchThrowableOfType(
        () -> RecordMaps.fromMap(Cart.class, input), TypeCoercionException.class);

    assertThat(failure.path()).isEqualTo("items[1].quantity");
    assertThat(failure.externalKey()).isEqualTo("quantity");
    assertThat(failure.sourceKind()).isEqualTo("String");
    assertThat(failure.targetKind()).isEqualTo("int");
    assertThat(failure.getMessage()).startsWith("items[1].quantity: ");
  }

  @Test
  void nestedRecordMustBeAMap() {
    final Map<String, Object> input = Map.of("items", List.of("1x2"));

    assertThatThrownBy(() -> RecordMaps.fromMap(Cart.class, input))
        .isInstanceOf(TypeCoercionException.class)
        .extracting(t -> ((MarshalException) t).path()).isEqualTo("items[0]");
  }

  @Test
  void nullForRequiredFieldIsRejected() {
    final Map<String, Object> input = new HashMap<>();
    input.put("email", null);

    final TypeCoercionException failure = catchThrowableOfType(
        () -> RecordMaps.fromMap(Signup.class, input), TypeCoercionException.class);

    assertThat(failure.sourceKind()).isEqualTo("null");
    assertThat(failure.targetKind()).isEqualTo("String");
  }

  @Test
  void optionalComponentsFillWithEmpty() {
    final Profile profile = RecordMaps.fromMap(Profile.class, Map.of("name", "Ada"));
    assertThat(profile).isEqualTo(new Profile("Ada", Optional.empty(), Optional.empty()));

    final Map<String, Object> written = RecordMaps.toMap(profile);
    assertThat(written).containsEntry("nickname", null).containsEntry("birthday", null);

    final Profile full = new Profile("Ada", Optional.of("countess"), Optional.of(LocalDate.of(1815, 12, 10)));
    assertThat(RecordMaps.toMap(full)).containsEntry("birthday", "1815-12-10");
    assertThat(RecordMaps.fromMap(Profile.class, RecordMaps.toMap(full))).isEqualTo(full);
  }

  @Test
  void temporalKindsAndOpaqueContainersRoundTrip() {
    final Map<String, Object> carrierData = new LinkedHashMap<>();
    carrierData.put("carrier", "DHL");
    carrierData.put("legs", List.of(1, 2));
    final Shipment shipment = new Shipment(
        LocalDateTime.of(2024, 6, 15, 9, 30),
        OffsetDateTime.of(2024, 6, 17, 14, 5, 0, 0, ZoneOffset.ofHours(2)),
        Instant.parse("2024-06-16T08:00:00Z"),
        List.of(LocalDate.of(2024, 6, 16), LocalDate.of(2024, 6, 17)),
        carrierData,
        List.of("created", Map.of("at", "depot")));

    final Map<String, Object> map = RecordMaps.toMap(shipment);

    assertThat(map).containsEntry("dispatchedAt", "15/06/2024 09:30")
        .containsEntry("deliveredAt", "2024-06-17T14:05:00+02:00")
        .containsEntry("scannedAt", "2024-06-16 08:00:00")
        .containsEntry("attempts", List.of("2024-06-16", "2024-06-17"))
        .containsEntry("carrierData", carrierData)
        .containsEntry("history", List.of("created", Map.of("at", "depot")));
    assertThat(RecordMaps.fromMap(Shipment.class, map)).isEqualTo(shipment);
  }

  public record Catalog(Map<String, OrderItem> byCode) {
  }

  public record Pallets(List<List<OrderItem>> rows) {
  }

  public record Bag(List<Object> things, Object any) {
  }

  public record Fragile(int value) {
    public Fragile {
      if (value < 0) {
        throw new AssertionError("negative " + value);
      }
    }
  }

  @Test
  void typedMapValuesAreMarshaled() {
    final Map<String, OrderItem> byCode = new LinkedHashMap<>();
    byCode.put("a", new OrderItem(1, 2));
    byCode.put("b", new OrderItem(2, 5));
    final Catalog catalog = new Catalog(byCode);

    final Map<String, Object> map = RecordMaps.toMap(catalog);

    assertThat(map.get("byCode")).isEqualTo(Map.of(
        "a", Map.of("productId", 1, "quantity", 2),
        "b", Map.of("productId", 2, "quantity", 5)));
    final Catalog copy = RecordMaps.fromMap(Catalog.class, map);
    assertThat(copy).isEqualTo(catalog);
    assertThat(copy.byCode().get("a")).isInstanceOf(OrderItem.class);
  }

  @Test
  void typedMapFailureNamesTheKey() {
    final Map<String, Object> input = Map.of("byCode", Map.of("a", Map.of("productId", 1, "quantity", "many")));

    final TypeCoercionException failure = catchThrowableOfType(
        () -> RecordMaps.fromMap(Catalog.class, input), TypeCoercionException.class);

    assertThat(failure.path()).isEqualTo("byCode[a].quantity");
    assertThat(failure.targetKind()).isEqualTo("int");
  }

  @Test
  void listsOfListsOfRecordsAreMarshaled() {
    final Pallets pallets = new Pallets(List.of(
        List.of(new OrderItem(1, 1)),
        List.of(new OrderItem(2, 2), new OrderItem(3, 3))));

    final Map<String, Object> map = RecordMaps.toMap(pallets);

    assertThat(map.get("rows")).isEqualTo(List.of(
        List.of(Map.of("productId", 1, "quantity", 1)),
        List.of(Map.of("productId", 2, "quantity", 2), Map.of("productId", 3, "quantity", 3))));
    final Pallets copy = RecordMaps.fromMap(Pallets.class, map);
    assertThat(copy).isEqualTo(pallets);
    assertThat(copy.rows().get(1).get(0)).isInstanceOf(OrderItem.class);

    final Map<String, Object> bad = Map.of("rows", List.of(
        List.of(Map.of("productId", 1, "quantity", 1)),
        List.of(Map.of("productId", 2, "quantity", "lots"))));
    assertThatThrownBy(() -> RecordMaps.fromMap(Pallets.class, bad))
        .isInstanceOf(TypeCoercionException.class)
        .extracting(t -> ((MarshalException) t).path()).isEqualTo("rows[1][0].quantity");
  }

  @Test
  void opaqueContentIsRenderedAsPlainValues() {
    final Bag bag = new Bag(
        List.of(new OrderItem(1, 2), OrderStatus.PAID, ORDER_ID, Map.of("nested", new OrderItem(3, 4))),
        new Customer("Ada", "ada@example.com", null));

    final Map<String, Object> map = RecordMaps.toMap(bag);

    assertThat(map.get("things")).isEqualTo(List.of(
        Map.of("productId", 1, "quantity", 2),
        "PAID",
        ORDER_ID.toString(),
        Map.of("nested", Map.of("productId", 3, "quantity", 4))));
    assertThat(map.get("any")).isEqualTo(Map.of("name", "Ada", "customer_email", "ada@example.com"));
  }

  @Test
  void opaqueContentWithNoPlainFormIsRejected() {
    final TypeCoercionException failure = catchThrowableOfType(
        () -> RecordMaps.toMap(new Bag(List.of(), Thread.currentThread())), TypeCoercionException.class);
    assertThat(failure.path()).isEqualTo("any");
    assertThat(failure.sourceKind()).isEqualTo("Thread");

    final TypeCoercionException inList = catchThrowableOfType(
        () -> RecordMaps.toMap(new Bag(List.of("ok", LocalDate.of(2024, 6, 15)), null)), TypeCoercionException.class);
    assertThat(inList.path()).isEqualTo("things[1]");
    assertThat(inList.sourceKind()).isEqualTo("LocalDate");
  }

  @Test
  void errorsFromConstructorsPropagateUnwrapped() {
    assertThatThrownBy(() -> RecordMaps.fromMap(Fragile.class, Map.of("value", -1)))
        .isInstanceOf(AssertionError.class)
        .hasMessage("negative -1");
    assertThat(RecordMaps.fromMap(Fragile.class, Map.of("value", 1))).isEqualTo(new Fragile(1));
  }

  @Test
  void resultListsAreUnmodifiable() {
    final Cart cart = RecordMaps.fromMap(Cart.class, Map.of("items", List.of(Map.of("productId", 1, "quantity", 1))));

    assertThatThrownBy(() -> cart.items().add(new OrderItem(2, 2))).isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void constructorRejectionIsReported() {
    final RecordConstructionException failure = catchThrowableOfType(
        () -> RecordMaps.fromMap(Quantity.class, Map.of("value", -1)), RecordConstructionException.class);

    assertThat(failure.getCause()).isInstanceOf(IllegalArgumentException.class);
    assertThat(failure.getMessage()).contains("quantity must not be negative");
  }

  @Test
  void nullArgumentsAreRejected() {
    assertThatThrownBy(() -> RecordMaps.toMap(null)).isInstanceOf(NullPointerException.class);
    assertThatThrownBy(() -> RecordMaps.fromMap(Signup.class, null)).isInstanceOf(NullPointerException.class);
  }

  @Test
  void invalidTypesFailAtFactory() {
    assertThatThrownBy(() -> RecordMapper.forRecord(InvalidRecords.UndatedEvent.class))
        .isInstanceOf(InvalidMetadataException.class)
        .hasMessageContaining("@DateFormat");
  }

  @Test
  void concurrentCallsAgree() {
    final RecordMapper<Order> mapper = RecordMapper.forRecord(Order.class);
    final Order order = sampleOrder();
    final Map<String, Object> expected = mapper.toMap(order);

    final List<Map<String, Object>> maps = IntStream.range(0, 64).parallel()
        .mapToObj(i -> mapper.toMap(order)).toList();
    final List<Order> orders = IntStream.range(0, 64).parallel()
        .mapToObj(i -> mapper.fromMap(expected)).toList();

    assertThat(maps).allSatisfy(map -> assertThat(map).isEqualTo(expected));
    assertThat(orders).allSatisfy(copy -> assertThat(copy).isEqualTo(order));
  }
}

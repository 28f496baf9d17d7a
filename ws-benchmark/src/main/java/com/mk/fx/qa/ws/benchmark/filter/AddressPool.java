package com.mk.fx.qa.ws.benchmark.filter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.ws.benchmark.model.FatalConfigurationException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.stream.IntStream;
import lombok.extern.slf4j.Slf4j;

/**
 * Immutable set of candidate filter values. Duplicates and blank entries from the source file are
 * dropped so that every index is a distinct value.
 */
@Slf4j
public final class AddressPool {

  public static final int DEFAULT_FAKE_SIZE = 10_000;

  private final List<String> addresses;

  public AddressPool(List<String> addresses) {
    Objects.requireNonNull(addresses, "addresses");
    var distinct = new LinkedHashSet<String>();
    for (String address : addresses) {
      if (address != null && !address.isBlank()) {
        distinct.add(address.trim());
      }
    }
    if (distinct.isEmpty()) {
      throw new FatalConfigurationException("Address pool cannot be empty");
    }
    this.addresses = List.copyOf(distinct);
  }

  public static AddressPool load(Path file, ObjectMapper mapper) {
    Objects.requireNonNull(file, "file");
    Objects.requireNonNull(mapper, "mapper");
    List<String> values;
    try {
      values = mapper.readValue(file.toFile(), new TypeReference<List<String>>() {});
    } catch (IOException e) {
      throw new FatalConfigurationException(
          "Failed to read token addresses from " + file + ": " + e.getMessage(), e);
    }
    if (values == null || values.isEmpty()) {
      throw new FatalConfigurationException("Token address file " + file + " is empty");
    }
    var pool = new AddressPool(values);
    log.info("Loaded {} token addresses from {}", pool.size(), file);
    return pool;
  }

  public static AddressPool generateFake(int count) {
    if (count <= 0) {
      throw new IllegalArgumentException("count must be > 0");
    }
    var values = new ArrayList<String>(count);
    IntStream.range(0, count).forEach(i -> values.add(String.format("token_%08x", i)));
    return new AddressPool(values);
  }

  /** Loads {@code file} when it exists, otherwise falls back to {@link #DEFAULT_FAKE_SIZE} fakes. */
  public static AddressPool loadOrGenerate(Path file, ObjectMapper mapper) {
    if (file != null && Files.exists(file)) {
      return load(file, mapper);
    }
    log.warn(
        "Token address file {} not found, using {} generated addresses",
        file,
        DEFAULT_FAKE_SIZE);
    return generateFake(DEFAULT_FAKE_SIZE);
  }

  public int size() {
    return addresses.size();
  }

  public String get(int index) {
    return addresses.get(index);
  }

  public List<String> addresses() {
    return addresses;
  }
}

package checkin.spring.boot;

import checkin.CheckinEngine;
import checkin.action.InvalidActionException;
import checkin.action.SnoozeRequest;
import checkin.crypto.AesGcmPhoneDecryptor;
import checkin.jdbc.DataSourceConnectionProvider;
import checkin.jdbc.store.AbstractJdbcCheckinStore;
import checkin.jdbc.store.H2CheckinStore;
import checkin.model.CheckinEvent;
import checkin.model.CheckinTime;
import checkin.spi.ConnectionProvider;
import checkin.spi.PhoneDecryptor;
import checkin.spi.SmsResult;
import checkin.spi.SmsSender;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import javax.sql.DataSource;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class CheckinAutoConfigurationTest {
  private static final String KEY_HEX = "000102030405060708090a0b0c0d0e0f101112131415161718191a1b1c1d1e1f";
  private static final Instant NINE = Instant.parse("2026-03-10T09:00:00Z");

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(
          DataSourceAutoConfiguration.class,
          CheckinAutoConfiguration.class))
      .withPropertyValues(
          "spring.datasource.url=jdbc:h2:mem:checkin_auto_" + UUID.randomUUID() + ";MODE=MySQL;DB_CLOSE_DELAY=-1",
          "spring.datasource.driver-class-name=org.h2.Driver",
          "checkin.auto-start=false",
          "checkin.jdbc.initialize-schema=true",
          "checkin.encryption.phone-key=" + KEY_HEX);

  @Test
  void createsAllBeans() {
    runner.withUserConfiguration(SmsConfig.class).run(ctx -> {
      assertTrue(ctx.containsBean("checkinStore"));
      assertTrue(ctx.containsBean("connectionProvider"));
      assertTrue(ctx.containsBean("checkinSchemaInitializer"));
      assertTrue(ctx.containsBean("phoneDecryptor"));
      assertTrue(ctx.containsBean("checkinEngine"));

      assertInstanceOf(H2CheckinStore.class, ctx.getBean(AbstractJdbcCheckinStore.class));
      assertInstanceOf(DataSourceConnectionProvider.class, ctx.getBean(ConnectionProvider.class));
      assertInstanceOf(AesGcmPhoneDecryptor.class, ctx.getBean(PhoneDecryptor.class));
      assertNotNull(ctx.getBean(CheckinEngine.class));
    });
  }

  @Test
  void initializesSchema() {
    runner.withUserConfiguration(SmsConfig.class).run(ctx -> {
      JdbcTemplate jdbc = new JdbcTemplate(ctx.getBean(DataSource.class));
      assertEquals(0, jdbc.queryForObject("SELECT COUNT(*) FROM users", Integer.class));
      assertEquals(0, jdbc.queryForObject("SELECT COUNT(*) FROM checkin_events", Integer.class));
    });
  }

  @Test
  void schemaLeftAloneByDefault() {
    runner
        .withPropertyValues("checkin.jdbc.initialize-schema=false")
        .withUserConfiguration(SmsConfig.class).run(ctx -> {
          assertFalse(ctx.containsBean("checkinSchemaInitializer"));
          assertNotNull(ctx.getBean(CheckinEngine.class));
        });
  }

  @Test
  void escalatesMissedCheckinWithEncryptedPhones() {
    runner.withUserConfiguration(SmsConfig.class).run(ctx -> {
      seed(ctx.getBean(DataSource.class), ctx.getBean(AbstractJdbcCheckinStore.class),
          encrypt("+15550000001"));
      CheckinEngine engine = ctx.getBean(CheckinEngine.class);

      assertEquals(1, engine.tick(NINE).eventsCreated());
      assertEquals(1, engine.tick(NINE.plusSeconds(16 * 60)).eventsEscalated());

      RecordingSms sms = ctx.getBean(RecordingSms.class);
      assertEquals(List.of("+15550000001"), sms.phones);
    });
  }

  @Test
  void appliesSnoozeProperties() {
    runner
        .withPropertyValues("checkin.snooze.options=5,20", "checkin.snooze.default-minutes=20")
        .withUserConfiguration(SmsConfig.class).run(ctx -> {
          seed(ctx.getBean(DataSource.class), ctx.getBean(AbstractJdbcCheckinStore.class), "unused");
          CheckinEngine engine = ctx.getBean(CheckinEngine.class);
          engine.tick(NINE);
          CheckinEvent event = engine.getCurrentCheckin("u1").orElseThrow();

          assertThrows(InvalidActionException.class,
              () -> engine.snoozeCheckin("u1", new SnoozeRequest(event.eventId(), 10), NINE.plusSeconds(60)));
          var response = engine.snoozeCheckin("u1", new SnoozeRequest(event.eventId(), null), NINE.plusSeconds(60));
          assertEquals(event.deadlineTime().plusSeconds(20 * 60), response.newDeadline());
        });
  }

  @Test
  void failsWithoutSmsSender() {
    runner.run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertInstanceOf(IllegalStateException.class, findRootCause(ctx.getStartupFailure()));
    });
  }

  @Test
  void failsWithoutPhoneKeyOrDecryptor() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(
            DataSourceAutoConfiguration.class,
            CheckinAutoConfiguration.class))
        .withPropertyValues(
            "spring.datasource.url=jdbc:h2:mem:checkin_nokey_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1",
            "spring.datasource.driver-class-name=org.h2.Driver",
            "checkin.auto-start=false")
        .withUserConfiguration(SmsConfig.class)
        .run(ctx -> {
          assertNotNull(ctx.getStartupFailure());
          assertInstanceOf(IllegalStateException.class, findRootCause(ctx.getStartupFailure()));
        });
  }

  @Test
  void rejectsMalformedPhoneKey() {
    runner
        .withPropertyValues("checkin.encryption.phone-key=abcd")
        .withUserConfiguration(SmsConfig.class).run(ctx -> {
          assertNotNull(ctx.getStartupFailure());
          assertInstanceOf(IllegalArgumentException.class, findRootCause(ctx.getStartupFailure()));
        });
  }

  @Test
  void notLoadedWithoutDataSource() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(CheckinAutoConfiguration.class))
        .withUserConfiguration(SmsConfig.class)
        .run(ctx -> {
          assertFalse(ctx.containsBean("checkinEngine"));
        });
  }

  @Test
  void respectsConditionalOnMissingBean() {
    runner.withUserConfiguration(SmsConfig.class, CustomBeansConfig.class).run(ctx -> {
      assertEquals("my_custom_store", ctx.getBeanNamesForType(AbstractJdbcCheckinStore.class)[0]);
      assertFalse(ctx.containsBean("phoneDecryptor"));
      assertFalse(ctx.getBean(PhoneDecryptor.class) instanceof AesGcmPhoneDecryptor);
    });
  }

  // ── Test configurations ──────────────────────────────────────

  static final class RecordingSms implements SmsSender {
    final List<String> phones = new CopyOnWriteArrayList<>();

    @Override
    public SmsResult send(String phone, String body) {
      phones.add(phone);
      return SmsResult.sent("SM" + phones.size(), "queued");
    }
  }

  @Configuration
  static class SmsConfig {
    @Bean
    RecordingSms recordingSms() {
      return new RecordingSms();
    }
  }

  @Configuration
  static class CustomBeansConfig {
    @Bean("my_custom_store")
    AbstractJdbcCheckinStore checkinStore() {
      return new H2CheckinStore();
    }

    @Bean
    PhoneDecryptor plainDecryptor() {
      return ciphertext -> ciphertext;
    }
  }

  private static void seed(DataSource dataSource, AbstractJdbcCheckinStore store, String phoneEnc) {
    JdbcTemplate jdbc = new JdbcTemplate(dataSource);
    jdbc.update("INSERT INTO users (user_id, name, timezone, checkin_times, grace_minutes, sms_alerts_enabled)"
        + " VALUES (?,?,?,?,?,?)", "u1", "Alice", "UTC",
        store.encodeTimes(List.of(CheckinTime.parse("09:00"))), 15, true);
    jdbc.update("INSERT INTO contacts (contact_id, user_id, name, level, phone_enc, has_app) VALUES (?,?,?,?,?,?)",
        "c1", "u1", "Bob", 1, phoneEnc, false);
  }

  private static String encrypt(String plain) throws Exception {
    byte[] iv = new byte[12];
    new SecureRandom().nextBytes(iv);
    Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
    cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(HexFormat.of().parseHex(KEY_HEX), "AES"),
        new GCMParameterSpec(128, iv));
    byte[] ct = cipher.doFinal(plain.getBytes(StandardCharsets.UTF_8));
    byte[] combined = new byte[iv.length + ct.length];
    System.arraycopy(iv, 0, combined, 0, iv.length);
    System.arraycopy(ct, 0, combined, iv.length, ct.length);
    return HexFormat.of().formatHex(combined);
  }

  private static Throwable findRootCause(Throwable t) {
    while (t.getCause() != null && t.getCause() != t) {
      t = t.getCause();
    }
    return t;
  }
}

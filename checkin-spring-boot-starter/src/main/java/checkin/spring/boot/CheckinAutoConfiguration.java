package checkin.spring.boot;

import checkin.CheckinEngine;
import checkin.crypto.AesGcmPhoneDecryptor;
import checkin.jdbc.DataSourceConnectionProvider;
import checkin.jdbc.store.AbstractJdbcCheckinStore;
import checkin.jdbc.store.JdbcCheckinStores;
import checkin.retry.RetryPolicy;
import checkin.spi.AlertComposer;
import checkin.spi.ConnectionProvider;
import checkin.spi.MetricsExporter;
import checkin.spi.PhoneDecryptor;
import checkin.spi.PushSender;
import checkin.spi.SmsSender;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for the check-in engine.
 *
 * <p>Wires a {@link CheckinEngine} from a {@link DataSource}, {@link CheckinProperties}
 * and the channel beans in the context. An {@link SmsSender} is required: define one or
 * set {@code checkin.twilio.*} with {@code checkin-providers} on the classpath. Phone
 * numbers are decrypted with {@code checkin.encryption.phone-key} unless a
 * {@link PhoneDecryptor} bean is present.
 *
 * @see CheckinProperties
 * @see CheckinProvidersAutoConfiguration
 * @see CheckinMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(CheckinEngine.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(CheckinProperties.class)
public class CheckinAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public AbstractJdbcCheckinStore checkinStore(DataSource dataSource) {
    return JdbcCheckinStores.detect(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnProperty(prefix = "checkin.jdbc", name = "initialize-schema", havingValue = "true")
  public CheckinSchemaInitializer checkinSchemaInitializer(DataSource dataSource,
      AbstractJdbcCheckinStore checkinStore) {
    return new CheckinSchemaInitializer(dataSource, checkinStore);
  }

  @Bean
  @ConditionalOnMissingBean(PhoneDecryptor.class)
  @ConditionalOnProperty(prefix = "checkin.encryption", name = "phone-key")
  public AesGcmPhoneDecryptor phoneDecryptor(CheckinProperties props) {
    return new AesGcmPhoneDecryptor(props.getEncryption().getPhoneKey());
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public CheckinEngine checkinEngine(CheckinProperties props,
      ConnectionProvider connectionProvider,
      AbstractJdbcCheckinStore checkinStore,
      ObjectProvider<CheckinSchemaInitializer> schemaInitializer,
      ObjectProvider<SmsSender> smsSenderProvider,
      ObjectProvider<PhoneDecryptor> phoneDecryptorProvider,
      ObjectProvider<PushSender> pushSenderProvider,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<AlertComposer> alertComposerProvider,
      ObjectProvider<RetryPolicy> retryPolicyProvider) {

    // Tables must exist before the ticker runs.
    schemaInitializer.getIfAvailable();

    SmsSender smsSender = smsSenderProvider.getIfAvailable();
    if (smsSender == null) {
      throw new IllegalStateException(
          "No SmsSender available: define an SmsSender bean or set checkin.twilio.*");
    }
    PhoneDecryptor phoneDecryptor = phoneDecryptorProvider.getIfAvailable();
    if (phoneDecryptor == null) {
      throw new IllegalStateException(
          "No PhoneDecryptor available: set checkin.encryption.phone-key or define a PhoneDecryptor bean");
    }

    var builder = CheckinEngine.builder()
        .connectionProvider(connectionProvider)
        .store(checkinStore)
        .smsSender(smsSender)
        .phoneDecryptor(phoneDecryptor)
        .tickInterval(props.getTickInterval())
        .tolerance(props.getTolerance())
        .userLocalTime(props.isUserLocalTime())
        .maxRetries(props.getMaxRetries())
        .deliveryWorkers(props.getDeliveryWorkers())
        .sendTimeout(props.getSendTimeout())
        .batchSize(props.getBatchSize())
        .snoozeLimit(props.getSnooze().getLimit())
        .snoozeOptions(props.getSnooze().optionSet())
        .defaultSnoozeMinutes(props.getSnooze().getDefaultMinutes());
    pushSenderProvider.ifAvailable(builder::pushSender);
    metricsProvider.ifAvailable(builder::metrics);
    alertComposerProvider.ifAvailable(builder::alertComposer);
    retryPolicyProvider.ifAvailable(builder::retryPolicy);

    CheckinEngine engine = builder.build();
    if (props.isAutoStart()) {
      engine.start();
    }
    return engine;
  }
}

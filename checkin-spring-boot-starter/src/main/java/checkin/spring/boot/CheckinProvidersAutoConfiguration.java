package checkin.spring.boot;

import checkin.providers.apns.ApnsPushSender;
import checkin.providers.twilio.TwilioSmsSender;
import checkin.spi.PushSender;
import checkin.spi.SmsSender;
import com.eatthepath.pushy.apns.ApnsClient;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.File;

/**
 * Auto-configuration for the bundled Twilio and APNs channels.
 *
 * <p>A {@link TwilioSmsSender} is created when {@code checkin.twilio.account-sid} is set,
 * an {@link ApnsPushSender} when {@code checkin.apns.key-file} is set. Either backs off
 * when the application defines its own {@link SmsSender} or {@link PushSender}.
 */
@AutoConfiguration(before = CheckinAutoConfiguration.class)
@ConditionalOnClass(TwilioSmsSender.class)
@EnableConfigurationProperties(CheckinProperties.class)
public class CheckinProvidersAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(SmsSender.class)
  @ConditionalOnProperty(prefix = "checkin.twilio", name = "account-sid")
  public TwilioSmsSender twilioSmsSender(CheckinProperties props) {
    CheckinProperties.Twilio twilio = props.getTwilio();
    return TwilioSmsSender.builder()
        .accountSid(twilio.getAccountSid())
        .authToken(twilio.getAuthToken())
        .fromNumber(twilio.getFromNumber())
        .baseUrl(twilio.getBaseUrl())
        .requestTimeout(twilio.getRequestTimeout())
        .build();
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnClass(ApnsClient.class)
  static class ApnsConfiguration {

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(PushSender.class)
    @ConditionalOnProperty(prefix = "checkin.apns", name = "key-file")
    public ApnsPushSender apnsPushSender(CheckinProperties props) {
      CheckinProperties.Apns apns = props.getApns();
      return ApnsPushSender.builder()
          .signingKey(new File(apns.getKeyFile()), apns.getTeamId(), apns.getKeyId())
          .topic(apns.getTopic())
          .sandbox(apns.isSandbox())
          .sendTimeout(apns.getSendTimeout())
          .build();
    }
  }
}

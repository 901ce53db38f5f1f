package checkin.spring.boot;

import checkin.jdbc.store.AbstractJdbcCheckinStore;

import org.springframework.beans.factory.InitializingBean;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.init.DatabasePopulatorUtils;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import javax.sql.DataSource;
import java.util.logging.Logger;

/**
 * Runs the detected store's bundled schema script against the application DataSource.
 *
 * <p>Enabled with {@code checkin.jdbc.initialize-schema=true}. The scripts create the
 * tables unconditionally, so this is meant for empty databases such as tests and demos.
 */
public class CheckinSchemaInitializer implements InitializingBean {
  private static final Logger logger = Logger.getLogger(CheckinSchemaInitializer.class.getName());

  private final DataSource dataSource;
  private final AbstractJdbcCheckinStore store;

  public CheckinSchemaInitializer(DataSource dataSource, AbstractJdbcCheckinStore store) {
    this.dataSource = dataSource;
    this.store = store;
  }

  @Override
  public void afterPropertiesSet() {
    String resource = store.schemaResource();
    ResourceDatabasePopulator populator = new ResourceDatabasePopulator(new ClassPathResource(resource));
    DatabasePopulatorUtils.execute(populator, dataSource);
    logger.info("Initialized check-in schema from " + resource);
  }
}

package outreach.spring.boot;

import outreach.redis.RedisKeyValueStore;
import outreach.spi.KeyValueStore;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Backs the engine with Redis when Spring Data Redis has configured a
 * {@link StringRedisTemplate} and no other {@link KeyValueStore} is defined.
 */
@AutoConfiguration(
    before = OutreachAutoConfiguration.class,
    afterName = "org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration")
@ConditionalOnClass({RedisKeyValueStore.class, StringRedisTemplate.class})
public class OutreachRedisAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(KeyValueStore.class)
  @ConditionalOnBean(StringRedisTemplate.class)
  public RedisKeyValueStore redisKeyValueStore(StringRedisTemplate stringRedisTemplate) {
    return new RedisKeyValueStore(stringRedisTemplate);
  }
}

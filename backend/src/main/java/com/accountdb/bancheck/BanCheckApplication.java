package com.accountdb.bancheck;

import com.accountdb.bancheck.check.http.SteamProfileClient;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BanCheckApplication {

  public static void main(String[] args) {
    SteamProfileClient.allowBasicProxyTunnelAuth();
    SpringApplication.run(BanCheckApplication.class, args);
  }
}

package com.sgbc.sgbcPrj.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/** sgbc.* in application.yml */
@Data
@Component
@ConfigurationProperties(prefix = "sgbc")
public class SgbcProperties {

    private Circulation circulation = new Circulation();
    private Seed seed = new Seed();

    @Data
    public static class Circulation {
        /** due date = loan date + this many days */
        private int loanPeriodDays = 14;
        /** OPEN loans a reader may hold at once */
        private int maxOpenLoansPerReader = 3;
    }

    @Data
    public static class Seed {
        private boolean enabled = true;
        private String adminName = "Administração Central";
        private String adminEmail = "admin@rede.com";
        private String adminPassword = "admin123";
        private String centralLibraryName = "Biblioteca Central (Sede)";
        private String centralLibraryCity = "Capital";
    }
}

package com.agilab.file_retrieval.domain.model;

import com.agilab.file_retrieval.domain.entity.JsonColumnConverters;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProtocolSettingsTest {

    @Test
    void ftpSettings_shouldApplyDefaults() {
        var settings = new FtpSettings("ftp.partner.example", null, "loader", "ftp-password", null, null, null);

        assertThat(settings.port()).isEqualTo(21);
        assertThat(settings.useTls()).isTrue();
        assertThat(settings.passiveMode()).isTrue();
        assertThat(settings.connectionTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(settings.serverAddress()).isEqualTo("ftp.partner.example:21");
    }

    @Test
    void ftpSettings_shouldRejectInvalidValues() {
        assertThatThrownBy(() -> new FtpSettings("ftp.example", 70000, "u", "s", null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FtpSettings("ftp-{yyyy}.example", 21, "u", "s", null, null, null))
                .hasMessageContaining("Date tokens");
        assertThatThrownBy(() -> new FtpSettings("ftp.example", 21, " ", "s", null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void httpsSettings_shouldRequireSecretForAuthentication() {
        assertThatThrownBy(() -> new HttpsSettings("https://files.example", HttpAuthType.BEARER_TOKEN, null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new HttpsSettings("ftp://files.example", HttpAuthType.NONE, null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(new HttpsSettings("https://files.example/api", null, null, null, null, null).authenticationType())
                .isEqualTo(HttpAuthType.NONE);
    }

    @Test
    void azureBlobSettings_shouldValidateContainerAndDeriveEndpoint() {
        var settings = new AzureBlobSettings("acct", "inbound", null, null, null, null, null, null);

        assertThat(settings.authenticationType()).isEqualTo(AzureAuthType.MANAGED_IDENTITY);
        assertThat(settings.serverAddress()).isEqualTo("https://acct.blob.core.windows.net");
        assertThatThrownBy(() -> new AzureBlobSettings("acct", "Inbound", null, null, null, null, null, null))
                .hasMessageContaining("lowercase");
        assertThatThrownBy(() -> new AzureBlobSettings("acct", "inbound", AzureAuthType.SAS_TOKEN, null, null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void jsonColumn_shouldKeepTheProtocolVariant() {
        var converter = new JsonColumnConverters.ProtocolSettingsConverter();
        var settings = new FtpSettings("ftp.partner.example", 2121, "loader", "ftp-password", false, true, Duration.ofSeconds(5));

        var json = converter.convertToDatabaseColumn(settings);

        assertThat(json).contains("\"protocol\":\"Ftp\"");
        assertThat(converter.convertToEntityAttribute(json)).isEqualTo(settings);
    }

    @Test
    void definitions_shouldRejectMissingNamesAndCopyData() {
        var data = new HashMap<String, Object>(Map.of("k", "v"));
        var definition = new EventDefinition("FileDiscovered", data);
        data.put("k", "changed");

        assertThat(definition.eventData()).containsEntry("k", "v");
        assertThatThrownBy(() -> new EventDefinition(" ", Map.of())).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CommandDefinition("Process", "", Map.of())).isInstanceOf(IllegalArgumentException.class);
        var commands = new JsonColumnConverters.CommandDefinitionsConverter();
        assertThat(commands.convertToEntityAttribute(null)).isEqualTo(List.of());
    }
}

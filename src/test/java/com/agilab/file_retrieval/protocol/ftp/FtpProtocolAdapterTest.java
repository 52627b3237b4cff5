package com.agilab.file_retrieval.protocol.ftp;

import com.agilab.file_retrieval.domain.model.FtpSettings;
import com.agilab.file_retrieval.exception.ErrorCategory;
import com.agilab.file_retrieval.exception.PermanentFileCheckException;
import com.agilab.file_retrieval.protocol.ListingRequest;
import com.agilab.file_retrieval.protocol.RemoteFile;
import org.apache.commons.net.ftp.FTPClient;
import org.apache.commons.net.ftp.FTPFile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.UncheckedIOException;
import java.net.ConnectException;
import java.time.Instant;
import java.util.Calendar;
import java.util.TimeZone;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.InstanceOfAssertFactories.type;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FtpProtocolAdapterTest {

    private static final Instant MODIFIED = Instant.parse("2026-02-01T08:00:00Z");

    @Mock
    private FTPClient client;

    private FtpProtocolAdapter adapter;

    @BeforeEach
    void setUp() {
        var settings = new FtpSettings("ftp.partner.example", 21, "loader", "ftp-password", false, true, null);
        adapter = new FtpProtocolAdapter(settings, name -> "pw-" + name, ignored -> client);
    }

    @Test
    void listFiles_shouldReturnMatchingFilesAndDisconnect() throws Exception {
        when(client.getReplyCode()).thenReturn(220);
        when(client.login("loader", "pw-ftp-password")).thenReturn(true);
        when(client.listFiles("/in")).thenReturn(new FTPFile[]{
                file("A.csv", 10), directory("archive"), file("notes.txt", 5), file("B.CSV", 20)});
        when(client.isConnected()).thenReturn(true);

        var files = adapter.listFiles(new ListingRequest("/in", "*.csv", null));

        assertThat(files).extracting(RemoteFile::name).containsExactly("A.csv", "B.CSV");
        assertThat(files.get(0).uri()).isEqualTo("ftp://ftp.partner.example:21/in/A.csv");
        assertThat(files.get(0).size()).isEqualTo(10L);
        assertThat(files.get(0).lastModified()).isEqualTo(MODIFIED);
        verify(client).connect("ftp.partner.example", 21);
        verify(client).enterLocalPassiveMode();
        verify(client).logout();
        verify(client).disconnect();
    }

    @Test
    void listFiles_shouldFailPermanentlyWhenLoginIsRejected() throws Exception {
        when(client.getReplyCode()).thenReturn(220);
        when(client.login("loader", "pw-ftp-password")).thenReturn(false);
        when(client.isConnected()).thenReturn(true);

        assertThatThrownBy(() -> adapter.listFiles(new ListingRequest("/in", "*.csv", null)))
                .asInstanceOf(type(PermanentFileCheckException.class))
                .extracting(PermanentFileCheckException::getErrorCategory)
                .isEqualTo(ErrorCategory.AUTHENTICATION_FAILURE);
        verify(client, never()).listFiles(anyString());
        verify(client).disconnect();
    }

    @Test
    void listFiles_shouldSurfaceConnectionFailures() throws Exception {
        doThrow(new ConnectException("Connection refused")).when(client).connect("ftp.partner.example", 21);

        assertThatThrownBy(() -> adapter.listFiles(new ListingRequest("/in", "*.csv", null)))
                .isInstanceOf(UncheckedIOException.class)
                .hasCauseInstanceOf(ConnectException.class);
        verify(client, never()).disconnect();
    }

    private static FTPFile file(String name, long size) {
        var file = new FTPFile();
        file.setName(name);
        file.setType(FTPFile.FILE_TYPE);
        file.setSize(size);
        var timestamp = Calendar.getInstance(TimeZone.getTimeZone("UTC"));
        timestamp.setTimeInMillis(MODIFIED.toEpochMilli());
        file.setTimestamp(timestamp);
        file.setRawListing("-rw-r--r-- 1 ftp ftp " + size + " Feb 01 08:00 " + name);
        return file;
    }

    private static FTPFile directory(String name) {
        var directory = new FTPFile();
        directory.setName(name);
        directory.setType(FTPFile.DIRECTORY_TYPE);
        return directory;
    }
}

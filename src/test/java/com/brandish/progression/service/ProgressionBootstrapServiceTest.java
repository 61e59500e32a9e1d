package com.brandish.progression.service;

import com.brandish.progression.config.ProgressionProperties;
import com.brandish.progression.tree.ProgressionTreeLoader;
import com.brandish.progression.tree.TreeSyncResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProgressionBootstrapServiceTest {

    @Mock
    private ProgressionTreeLoader progressionTreeLoader;

    @Mock
    private ProgressionService progressionService;

    @Test
    void run_syncsTreeThenInitializesState() throws Exception {
        when(progressionTreeLoader.sync(false)).thenReturn(new TreeSyncResult(9, 0, 0, 1, false));

        service(true).run(null);

        verify(progressionTreeLoader).sync(false);
        verify(progressionService).initializeProgressionState();
    }

    @Test
    void run_skipsEverythingWhenSyncDisabled() throws Exception {
        service(false).run(null);

        verify(progressionTreeLoader, never()).sync(anyBoolean());
        verify(progressionService, never()).initializeProgressionState();
    }

    @Test
    void run_survivesInitializationFailure() throws Exception {
        when(progressionTreeLoader.sync(false)).thenReturn(TreeSyncResult.unchangedFile());
        doThrow(new IllegalStateException("db down")).when(progressionService).initializeProgressionState();

        service(true).run(null);

        verify(progressionService).initializeProgressionState();
    }

    private ProgressionBootstrapService service(boolean syncOnStartup) {
        ProgressionProperties properties = new ProgressionProperties();
        properties.getTree().setSyncOnStartup(syncOnStartup);
        return new ProgressionBootstrapService(properties, progressionTreeLoader, progressionService);
    }
}

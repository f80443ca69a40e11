package com.starscape.tasktrack.features.listtasks.app;

import com.starscape.tasktrack.common.config.TaskProperties;
import com.starscape.tasktrack.common.exception.ValidationException;
import com.starscape.tasktrack.features.gettask.app.TaskResponseAssembler;
import com.starscape.tasktrack.features.listtasks.infra.TaskFilter;
import com.starscape.tasktrack.features.listtasks.infra.TaskQueryRepository;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ListTasksHandlerTest {
    
    private final TaskQueryRepository taskQueryRepository = mock(TaskQueryRepository.class);
    private final TaskResponseAssembler assembler = mock(TaskResponseAssembler.class);
    private final TaskProperties properties = new TaskProperties();
    
    private final ListTasksHandler handler = new ListTasksHandler(taskQueryRepository, assembler, properties);
    
    @Test
    void defaultsToFirstPageOfTen() {
        when(taskQueryRepository.findVisible(any(), anyInt(), anyInt())).thenReturn(List.of());
        
        handler.handle(0, null, null, null, null);
        
        verify(taskQueryRepository).findVisible(new TaskFilter(null, null, List.of()), 0, 10);
    }
    
    @Test
    void clampsLimitToMaxPageSize() {
        when(taskQueryRepository.findVisible(any(), anyInt(), anyInt())).thenReturn(List.of());
        
        handler.handle(20, 5000, true, 5, null);
        
        verify(taskQueryRepository).findVisible(new TaskFilter(true, 5, List.of()), 20, 100);
    }
    
    @Test
    void passesEveryTagName() {
        when(taskQueryRepository.findVisible(any(), anyInt(), anyInt())).thenReturn(List.of());
        
        handler.handle(0, 10, null, null, "a, b");
        
        verify(taskQueryRepository).findVisible(new TaskFilter(null, null, List.of("a", "b")), 0, 10);
    }
    
    @Test
    void rejectsNegativeSkipAndZeroLimitTogether() {
        ValidationException ex = assertThrows(ValidationException.class,
                () -> handler.handle(-1, 0, null, null, null));
        
        assertEquals(2, ex.getFieldErrors().size());
        assertTrue(ex.getFieldErrors().containsKey("skip"));
        assertTrue(ex.getFieldErrors().containsKey("limit"));
        verifyNoInteractions(taskQueryRepository);
    }
    
    @Test
    void parsesCommaSeparatedTagNames() {
        assertEquals(List.of("a", "b", "c"), ListTasksHandler.parseTagNames(" a,b ,, c,a"));
        assertEquals(List.of(), ListTasksHandler.parseTagNames(" "));
        assertEquals(List.of(), ListTasksHandler.parseTagNames(null));
    }
}

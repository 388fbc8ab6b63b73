package io.github.goodees.factstore.example.ticket;

/*-
 * #%L
 * factstore
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import io.github.goodees.factstore.core.CommandHandler;
import io.github.goodees.factstore.core.CommandRejectedException;
import io.github.goodees.factstore.core.Fact;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class AssignTicketHandler implements CommandHandler<TicketCommands.AssignTicket, TicketContext, TicketEvent> {

    @Override
    public TicketContext initialContext(TicketCommands.AssignTicket command) {
        return TicketContext.EMPTY;
    }

    @Override
    public List<Fact<TicketContext, TicketEvent>> facts(TicketCommands.AssignTicket command) {
        return Arrays.asList(TicketFacts.exists(command.ticketId), TicketFacts.isClosed(command.ticketId),
            TicketFacts.currentAssignee(command.ticketId));
    }

    @Override
    public List<TicketEvent> decide(TicketCommands.AssignTicket command, TicketContext context)
            throws CommandRejectedException {
        if (!context.exists()) {
            throw new CommandRejectedException("Ticket " + command.ticketId + " does not exist");
        }
        if (context.isClosed()) {
            throw new CommandRejectedException("Ticket " + command.ticketId + " is closed");
        }
        if (command.assignee.equals(context.getAssignee())) {
            // already assigned, nothing to record
            return Collections.emptyList();
        }
        return Collections.<TicketEvent> singletonList(TicketAssignedEvent.of(command.ticketId, command.assignee));
    }
}

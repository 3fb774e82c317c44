/*
 * Copyright (C) 2014  Ohm Data
 *
 *  This program is free software: you can redistribute it and/or modify
 *  it under the terms of the GNU Affero General Public License as
 *  published by the Free Software Foundation, either version 3 of the
 *  License, or (at your option) any later version.
 *
 *  This program is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied warranty of
 *  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *  GNU Affero General Public License for more details.
 *
 *  You should have received a copy of the GNU Affero General Public License
 *  along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */

package pageserver.task;

import com.google.common.util.concurrent.ListenableFuture;
import pageserver.util.CancellationToken;

/**
 * Body of a task run by the {@link TaskManager}. It is asynchronous: the returned future
 * completes when the task is done. The shutdown token is cancelled when somebody asks the task
 * to stop; the body should then finish as soon as it conveniently can.
 */
@FunctionalInterface
public interface TaskFunction {
  ListenableFuture<Void> run(CancellationToken shutdown) throws Exception;
}

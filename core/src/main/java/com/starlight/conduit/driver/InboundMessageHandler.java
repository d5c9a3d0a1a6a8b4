// Copyright (c) 2010 Rob Eden.
// All rights reserved.
//
// Redistribution and use in source and binary forms, with or without
// modification, are permitted provided that the following conditions are met:
//     * Redistributions of source code must retain the above copyright
//       notice, this list of conditions and the following disclaimer.
//     * Redistributions in binary form must reproduce the above copyright
//       notice, this list of conditions and the following disclaimer in the
//       documentation and/or other materials provided with the distribution.
//     * Neither the name of Intrepid nor the
//       names of its contributors may be used to endorse or promote products
//       derived from this software without specific prior written permission.
//
// THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS" AND
// ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE IMPLIED
// WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE ARE
// DISCLAIMED. IN NO EVENT SHALL <COPYRIGHT HOLDER> BE LIABLE FOR ANY
// DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES
// (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES;
// LOSS OF USE, DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND
// ON ANY THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
// (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE OF THIS
// SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.

package com.starlight.conduit.driver;

import com.starlight.conduit.message.IMessage;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;


/**
 * Interface for handling received messages. Methods are called from the driver's IO
 * threads and must not block.
 */
public interface InboundMessageHandler {
	/**
	 * Called when a connection is opened, before any message is received on it.
	 *
	 * @param connection		The connection.
	 * @param opened_locally	Indicates whether or not the connection was opened
	 * 							locally.
	 */
	void connectionOpened( @Nonnull DriverConnection connection, boolean opened_locally );


	/**
	 * Called when a message is received.
	 *
	 * @param connection	The connection the message arrived on.
	 * @param message		The received message.
	 *
	 * @return If non-null, this message will be sent on the connection.
	 *
	 * @throws CloseConnectionIndicator	To signal that the driver should close the
	 * 									connection.
	 */
	@Nullable
	IMessage receivedMessage( @Nonnull DriverConnection connection,
		@Nonnull IMessage message ) throws CloseConnectionIndicator;


	/**
	 * Called once when a connection is closed, whichever side closed it.
	 *
	 * @param connection		The connection.
	 * @param closed_locally	True if the connection was closed locally.
	 */
	void connectionClosed( @Nonnull DriverConnection connection, boolean closed_locally );
}

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

import com.starlight.conduit.Endpoint;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.util.concurrent.TimeUnit;


/**
 * Interface for drivers that provide the transport for sessions. A driver instance
 * serves a single server or client session and is initialized exactly once.
 */
public interface ConduitDriver {
	/**
	 * Initialize the driver.
	 *
	 * @param message_handler		Handler for all inbound messages and connection
	 * 								events.
	 */
	void init( @Nonnull InboundMessageHandler message_handler );


	/**
	 * Indicates whether or not the driver can handle the given endpoint type in this
	 * environment.
	 */
	boolean supports( @Nonnull Endpoint.Type type );


	/**
	 * Start listening on the given endpoint.
	 *
	 * @return		The endpoint actually bound. For TCP endpoints with port zero this
	 * 				contains the ephemeral port chosen.
	 */
	@Nonnull Endpoint listen( @Nonnull Endpoint endpoint ) throws IOException;


	/**
	 * Open a connection to the given endpoint.
	 */
	@Nonnull DriverConnection connect( @Nonnull Endpoint endpoint, long timeout,
		@Nonnull TimeUnit timeout_unit ) throws IOException;


	/**
	 * Close all connections and listeners and release all resources, waiting for the
	 * driver's threads to terminate unless called from one of them.
	 */
	void shutdown();
}

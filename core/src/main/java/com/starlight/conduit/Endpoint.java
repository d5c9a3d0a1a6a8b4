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

package com.starlight.conduit;

import javax.annotation.Nonnull;
import java.nio.file.Path;
import java.util.Objects;

import static java.util.Objects.requireNonNull;


/**
 * A bind or connect target: a Unix-domain socket path, a VM socket (context ID and
 * port) or a TCP/IP host and port.
 */
public final class Endpoint {
	public enum Type {
		UNIX,
		VSOCK,
		INET
	}


	private final Type type;
	private final Path path;
	private final String host;
	private final int cid;
	private final int port;


	private Endpoint( Type type, Path path, String host, int cid, int port ) {
		this.type = type;
		this.path = path;
		this.host = host;
		this.cid = cid;
		this.port = port;
	}


	public static Endpoint unix( @Nonnull Path path ) {
		return new Endpoint( Type.UNIX, requireNonNull( path ), null, 0, 0 );
	}

	/**
	 * @param port		Port, or zero when binding to have an ephemeral port chosen.
	 */
	public static Endpoint inet( @Nonnull String host, int port ) {
		if ( port < 0 || port > 0xffff ) {
			throw new IllegalArgumentException( "Invalid port: " + port );
		}
		return new Endpoint( Type.INET, null, requireNonNull( host ), 0, port );
	}

	public static Endpoint vsock( int cid, int port ) {
		return new Endpoint( Type.VSOCK, null, null, cid, port );
	}


	@Nonnull
	public Type getType() {
		return type;
	}

	/**
	 * Socket path (Unix-domain endpoints only).
	 */
	public Path getPath() {
		return path;
	}

	/**
	 * Host (TCP/IP endpoints only).
	 */
	public String getHost() {
		return host;
	}

	/**
	 * Context ID (VM socket endpoints only).
	 */
	public int getCid() {
		return cid;
	}

	public int getPort() {
		return port;
	}


	@Override
	public String toString() {
		switch( type ) {
			case UNIX:
				return "unix:" + path;
			case VSOCK:
				return "vsock:" + cid + ":" + port;
			default:
				return "inet:" + host + ":" + port;
		}
	}


	@Override
	public boolean equals( Object o ) {
		if ( this == o ) return true;
		if ( o == null || getClass() != o.getClass() ) return false;

		Endpoint endpoint = ( Endpoint ) o;

		return cid == endpoint.cid &&
			port == endpoint.port &&
			type == endpoint.type &&
			Objects.equals( path, endpoint.path ) &&
			Objects.equals( host, endpoint.host );
	}

	@Override
	public int hashCode() {
		return Objects.hash( type, path, host, cid, port );
	}
}

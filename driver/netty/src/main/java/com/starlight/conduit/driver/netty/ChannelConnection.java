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

package com.starlight.conduit.driver.netty;

import com.starlight.conduit.driver.DriverConnection;
import com.starlight.conduit.message.IMessage;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.util.Attribute;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.channels.ClosedChannelException;

import static com.starlight.conduit.driver.netty.NettyConduitDriver.CONNECTION_KEY;
import static com.starlight.conduit.driver.netty.NettyConduitDriver.LOCAL_TERMINATE_KEY;


/**
 * {@link DriverConnection} backed by a Netty channel. One instance exists per channel.
 */
final class ChannelConnection implements DriverConnection {
	private static final Logger LOG = LoggerFactory.getLogger( ChannelConnection.class );

	private final Channel channel;
	private final NettyConduitDriver driver;

	private volatile Object attachment;


	private ChannelConnection( @Nonnull Channel channel,
		@Nonnull NettyConduitDriver driver ) {

		this.channel = channel;
		this.driver = driver;
	}


	static ChannelConnection of( @Nonnull Channel channel,
		@Nonnull NettyConduitDriver driver ) {

		Attribute<ChannelConnection> attribute = channel.attr( CONNECTION_KEY );
		ChannelConnection connection = attribute.get();
		if ( connection == null ) {
			connection = new ChannelConnection( channel, driver );
			ChannelConnection existing = attribute.setIfAbsent( connection );
			if ( existing != null ) connection = existing;
		}
		return connection;
	}


	@Override
	public void send( @Nonnull IMessage message ) throws IOException {
		if ( !channel.isActive() ) throw new ClosedChannelException();

		ChannelFuture future = channel.writeAndFlush( message );

		// IO threads never wait on writes, they'd be waiting on themselves or on each
		// other.
		if ( driver.isIoThread() ) {
			future.addListener( f -> {
				if ( !f.isSuccess() ) {
					LOG.debug( "Write of {} to {} failed", message, channel, f.cause() );
				}
			} );
			return;
		}

		future.awaitUninterruptibly();
		if ( !future.isSuccess() ) {
			Throwable cause = future.cause();
			if ( cause instanceof IOException ) throw ( IOException ) cause;
			throw new IOException( "Unable to write to " + channel, cause );
		}
	}

	@Override
	public void close() {
		channel.attr( LOCAL_TERMINATE_KEY ).set( Boolean.TRUE );
		channel.close();
	}

	@Override
	public boolean isOpen() {
		return channel.isActive();
	}


	@Nullable
	@Override
	public Object getAttachment() {
		return attachment;
	}

	@Override
	public void setAttachment( @Nullable Object attachment ) {
		this.attachment = attachment;
	}


	@Nonnull
	@Override
	public String getRemoteAddressDescription() {
		return channel.id().asShortText() + "/" +
			( channel.remoteAddress() == null ? "?" : channel.remoteAddress() );
	}


	@Override
	public String toString() {
		return "ChannelConnection{" + channel + '}';
	}
}
